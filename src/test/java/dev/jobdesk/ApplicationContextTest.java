package dev.jobdesk;

import dev.jobdesk.notify.CompletionNotifier;
import dev.jobdesk.notify.LoggingCompletionNotifier;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class ApplicationContextTest {

    @MockitoBean
    private DashboardRunner dashboardRunner;

    @MockitoBean
    private ExitManager exitManager;

    @Autowired
    private CompletionNotifier completionNotifier;

    @Test
    void contextLoads() {
        assertThat(completionNotifier).isInstanceOf(LoggingCompletionNotifier.class);
    }
}
