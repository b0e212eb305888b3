package com.ryuqq.ledger.adapter.file;

import com.ryuqq.ledger.core.spi.CounterLog;
import com.ryuqq.ledger.testkit.contract.AbstractCounterLogContractTest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Contract Tests for {@link FileCounterLog}.
 *
 * @author Ledger Team
 * @since 1.0.0
 */
class FileCounterLogContractTest extends AbstractCounterLogContractTest {

    @TempDir
    Path directory;

    @Override
    protected CounterLog createCounterLog() {
        return new FileCounterLog(FileStoreConfig.in(directory));
    }

    @AfterEach
    void closeLog() throws IOException {
        ((FileCounterLog) counterLog).close();
    }
}
