package com.distributedsystems.bhr;

import com.distributedsystems.bhr.repository.IAgentConfirmationRepository;
import com.distributedsystems.bhr.repository.IBlockRepository;
import com.distributedsystems.bhr.repository.IWhitelistEntryRepository;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;

/**
 * Base for tests that run the registry against the in-memory database. Registry writes
 * commit in their own transactions, so tables are emptied before each test instead of
 * rolling back.
 */
@SpringBootTest
@AutoConfigureMockMvc
@Import(TestClockConfig.class)
public abstract class RegistryTestSupport {

    @Autowired protected MutableClock clock;
    @Autowired protected IBlockRepository blockRepository;
    @Autowired protected IAgentConfirmationRepository confirmationRepository;
    @Autowired protected IWhitelistEntryRepository whitelistRepository;

    @BeforeEach
    void resetState() {
        confirmationRepository.deleteAllInBatch();
        blockRepository.deleteAllInBatch();
        whitelistRepository.deleteAllInBatch();
        clock.set(TestClockConfig.START);
    }
}
