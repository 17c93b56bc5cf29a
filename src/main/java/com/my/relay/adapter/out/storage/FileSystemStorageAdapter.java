package com.my.relay.adapter.out.storage;

import com.my.relay.config.AppConfig;
import com.my.relay.domain.port.out.LocalStoragePort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

/**
 * 왜: 임시 다운로드와 보관 디렉터리를 한 곳에서 만들고 정리해 다운로드 경로 구조를 도메인에서 숨기기 위함.
 */
@ApplicationScoped
public class FileSystemStorageAdapter implements LocalStoragePort {

    private static final Logger log = Logger.getLogger(FileSystemStorageAdapter.class);

    private final Path downloadRoot;
    private final Path archiveRoot;

    @Inject
    public FileSystemStorageAdapter(AppConfig appConfig) {
        this(Path.of(appConfig.storage().downloadPath()), Path.of(appConfig.storage().archivePath()));
    }

    FileSystemStorageAdapter(Path downloadRoot, Path archiveRoot) {
        this.downloadRoot = downloadRoot;
        this.archiveRoot = archiveRoot;
    }

    @Override
    public Path transientDirectory() {
        return ensure(downloadRoot);
    }

    @Override
    public Path archiveDirectory() {
        return ensure(archiveRoot);
    }

    @Override
    public long archivedFileCount() {
        try (Stream<Path> files = Files.list(archiveDirectory())) {
            return files.filter(Files::isRegularFile).count();
        } catch (IOException | IllegalStateException e) {
            log.warnf("보관 디렉터리를 읽을 수 없습니다 path=%s: %s", archiveRoot, e.getMessage());
            return 0L;
        }
    }

    @Override
    public boolean delete(Path localPath) {
        if (localPath == null) {
            return false;
        }
        try {
            return Files.deleteIfExists(localPath);
        } catch (IOException e) {
            log.warnf("로컬 파일 삭제 실패 path=%s: %s", localPath, e.getMessage());
            return false;
        }
    }

    private Path ensure(Path directory) {
        try {
            return Files.createDirectories(directory);
        } catch (IOException e) {
            throw new IllegalStateException("다운로드 디렉터리 생성 실패: " + directory, e);
        }
    }
}
