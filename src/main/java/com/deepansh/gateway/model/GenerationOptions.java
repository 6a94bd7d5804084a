package com.deepansh.gateway.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/** Provider-neutral generation knobs. Null means "provider default". */
@Value
@Builder(toBuilder = true)
public class GenerationOptions {

    Double temperature;
    Double topP;
    Integer maxTokens;
    List<String> stopSequences;

    /** JSON schema the answer must follow (structured output). */
    Map<String, Object> responseSchema;

    @Builder.Default
    boolean stream = true;

    public static GenerationOptions defaults() {
        return GenerationOptions.builder().build();
    }
}
