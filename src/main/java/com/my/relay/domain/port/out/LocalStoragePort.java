package com.my.relay.domain.port.out;

import java.nio.file.Path;

/**
 * 왜: 임시 다운로드와 보관용 다운로드 위치, 삭제를 도메인이 파일 시스템 세부 사항 없이 다루도록 하기 위함.
 */
public interface LocalStoragePort {

    Path transientDirectory();

    Path archiveDirectory();

    /**
     * 보관 디렉터리에 남아 있는 파일 수. 디렉터리를 읽을 수 없으면 0을 돌려준다.
     */
    long archivedFileCount();

    /**
     * 파일을 삭제한다. 이미 없으면 false, 삭제에 실패해도 예외 대신 false를 돌려준다.
     */
    boolean delete(Path localPath);
}
