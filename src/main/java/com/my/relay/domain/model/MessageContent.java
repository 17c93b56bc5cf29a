package com.my.relay.domain.model;

/**
 * 왜: 원본 메시지의 텍스트, 캡션, 미디어 설명을 재게시에 필요한 만큼만 담기 위함.
 */
public record MessageContent(String text, String caption, MediaDescriptor media) {

    public static MessageContent text(String text) {
        return new MessageContent(text, null, null);
    }

    public static MessageContent media(MediaDescriptor media, String caption) {
        return new MessageContent(null, caption, media);
    }

    public boolean hasMedia() {
        return media != null;
    }

    public boolean isEmpty() {
        return media == null && (text == null || text.isBlank());
    }

    /**
     * 미디어 캡션이 없으면 본문 텍스트를 캡션으로 쓴다.
     */
    public String effectiveCaption() {
        if (caption != null && !caption.isBlank()) {
            return caption;
        }
        return text == null ? "" : text;
    }
}
