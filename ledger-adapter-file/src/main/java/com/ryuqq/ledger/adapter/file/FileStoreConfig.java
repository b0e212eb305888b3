package com.ryuqq.ledger.adapter.file;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 파일 저장소 설정.
 *
 * <p>이벤트 로그와 카운터 로그의 위치, 내구성 수준, 손상 레코드 처리 방식을 정의합니다.</p>
 *
 * <p><strong>기본값:</strong></p>
 * <ul>
 *   <li>directory: data/logs</li>
 *   <li>eventLogFileName: shipments.jsonl</li>
 *   <li>counterLogFileName: shipment_counter.jsonl</li>
 *   <li>fsync: true (append마다 {@code FileChannel.force})</li>
 *   <li>strictReads: false (손상 레코드는 건너뛰고 WARN 기록)</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * FileStoreConfig config = new FileStoreConfig()
 *     .withDirectory(Path.of("/var/lib/ledger"))
 *     .withStrictReads(true);
 * </pre>
 *
 * @param directory 로그 파일 디렉터리
 * @param eventLogFileName 이벤트 로그 파일 이름
 * @param counterLogFileName 카운터 로그 파일 이름
 * @param fsync append마다 디스크 동기화 여부
 * @param strictReads 손상 레코드 발견 시 예외 발생 여부
 *
 * @author Ledger Team
 * @since 1.0.0
 */
public record FileStoreConfig(
    Path directory,
    String eventLogFileName,
    String counterLogFileName,
    boolean fsync,
    boolean strictReads
) {

    public static final Path DEFAULT_DIRECTORY = Paths.get("data", "logs");
    public static final String DEFAULT_EVENT_LOG = "shipments.jsonl";
    public static final String DEFAULT_COUNTER_LOG = "shipment_counter.jsonl";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException directory가 null이거나 파일 이름이 비어 있거나 두 파일 이름이 같은 경우
     */
    public FileStoreConfig {
        if (directory == null) {
            throw new IllegalArgumentException("directory cannot be null");
        }
        if (eventLogFileName == null || eventLogFileName.isBlank()) {
            throw new IllegalArgumentException("eventLogFileName cannot be null or blank");
        }
        if (counterLogFileName == null || counterLogFileName.isBlank()) {
            throw new IllegalArgumentException("counterLogFileName cannot be null or blank");
        }
        if (eventLogFileName.equals(counterLogFileName)) {
            throw new IllegalArgumentException(
                "eventLogFileName and counterLogFileName must differ, but both were: " + eventLogFileName);
        }
    }

    /**
     * 기본 설정으로 생성.
     */
    public FileStoreConfig() {
        this(DEFAULT_DIRECTORY, DEFAULT_EVENT_LOG, DEFAULT_COUNTER_LOG, true, false);
    }

    public static FileStoreConfig in(Path directory) {
        return new FileStoreConfig().withDirectory(directory);
    }

    public FileStoreConfig withDirectory(Path directory) {
        return new FileStoreConfig(directory, eventLogFileName, counterLogFileName, fsync, strictReads);
    }

    public FileStoreConfig withEventLogFileName(String eventLogFileName) {
        return new FileStoreConfig(directory, eventLogFileName, counterLogFileName, fsync, strictReads);
    }

    public FileStoreConfig withCounterLogFileName(String counterLogFileName) {
        return new FileStoreConfig(directory, eventLogFileName, counterLogFileName, fsync, strictReads);
    }

    public FileStoreConfig withFsync(boolean fsync) {
        return new FileStoreConfig(directory, eventLogFileName, counterLogFileName, fsync, strictReads);
    }

    public FileStoreConfig withStrictReads(boolean strictReads) {
        return new FileStoreConfig(directory, eventLogFileName, counterLogFileName, fsync, strictReads);
    }

    public Path eventLogPath() {
        return directory.resolve(eventLogFileName);
    }

    public Path counterLogPath() {
        return directory.resolve(counterLogFileName);
    }
}
