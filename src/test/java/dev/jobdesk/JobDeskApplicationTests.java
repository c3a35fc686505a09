package dev.jobdesk;

import dev.jobdesk.exception.StartupException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JobDeskApplicationTests {

    @Mock
    private DashboardRunner dashboardRunner;

    @Mock
    private ExitManager exitManager;

    @Test
    void shouldShowDashboardAndExitSuccessfully() {
        JobDeskApplication app = new JobDeskApplication(dashboardRunner, exitManager);

        when(dashboardRunner.execute()).thenReturn(2);

        app.run();

        verify(dashboardRunner).execute();
        verify(exitManager).exit(0);
    }

    @Test
    void shouldExitWithErrorWhenStorageNeverAnswers() {
        JobDeskApplication app = new JobDeskApplication(dashboardRunner, exitManager);

        when(dashboardRunner.execute()).thenThrow(new StartupException(new IOException("share offline")));

        app.run();

        verify(exitManager).exit(1);
    }
}
