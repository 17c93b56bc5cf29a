package com.my.relay.domain.model;

import java.util.Objects;

/**
 * 왜: 미디어 본문 없이 참조와 크기만으로 재게시/다운로드 여부를 판단하기 위함.
 */
public record MediaDescriptor(String reference, String fileName, String mimeType, long sizeBytes) {

    public MediaDescriptor {
        Objects.requireNonNull(reference, "reference");
        if (reference.isBlank()) {
            throw new IllegalArgumentException("미디어 참조는 비어 있을 수 없습니다.");
        }
        if (sizeBytes < 0) {
            throw new IllegalArgumentException("미디어 크기는 음수일 수 없습니다.");
        }
    }
}
