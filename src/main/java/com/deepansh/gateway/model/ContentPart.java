package com.deepansh.gateway.model;

import lombok.Builder;
import lombok.Value;

/** One typed piece of a multi-part message. */
@Value
@Builder
public class ContentPart {

    public enum Type {
        TEXT, IMAGE, TOOL_CALL, TOOL_RESULT
    }

    Type type;
    String text;

    /** IMAGE: either a remote URL or inline base64 data with its mime type. */
    String imageUrl;
    String imageData;
    String mimeType;

    /** TOOL_CALL / TOOL_RESULT: the referenced tool call id. */
    String toolCallId;

    public static ContentPart text(String text) {
        return ContentPart.builder().type(Type.TEXT).text(text).build();
    }

    public static ContentPart imageUrl(String url) {
        return ContentPart.builder().type(Type.IMAGE).imageUrl(url).build();
    }

    public static ContentPart inlineImage(String mimeType, String base64Data) {
        return ContentPart.builder().type(Type.IMAGE).mimeType(mimeType).imageData(base64Data).build();
    }
}
