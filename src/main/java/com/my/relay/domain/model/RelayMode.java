package com.my.relay.domain.model;

/**
 * 왜: 전달 표시 유지(FORWARD), 표시 없는 복사(COPY), 로컬 보관(DOWNLOAD) 요청을 같은 파이프라인에서 구분하기 위함.
 */
public enum RelayMode {
    FORWARD,
    COPY,
    DOWNLOAD
}
