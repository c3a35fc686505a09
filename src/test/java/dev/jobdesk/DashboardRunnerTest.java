package dev.jobdesk;

import dev.jobdesk.exception.StartupException;
import dev.jobdesk.snapshot.DashboardService;
import dev.jobdesk.snapshot.GlanceCounts;
import dev.jobdesk.store.JobRecordStore;
import dev.jobdesk.store.StorageBootstrap;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DashboardRunnerTest {

    @Mock
    private StorageBootstrap bootstrap;

    @Mock
    private JobRecordStore store;

    @Mock
    private DashboardService dashboardService;

    @InjectMocks
    private DashboardRunner dashboardRunner;

    @Test
    void execute_connectsThenReturnsJobCount() {
        // Arrange
        when(dashboardService.jobsAtAGlance()).thenReturn(Map.of(
                "105000", new GlanceCounts(1, 0, 0),
                "132068", GlanceCounts.NONE));

        // Act
        int result = dashboardRunner.execute();

        // Assert
        assertEquals(2, result);
        InOrder order = inOrder(bootstrap, dashboardService);
        order.verify(bootstrap).connect(store);
        order.verify(dashboardService).jobsAtAGlance();
    }

    @Test
    void execute_nothingAssigned_returnsZero() {
        when(dashboardService.jobsAtAGlance()).thenReturn(Map.of());

        assertEquals(0, dashboardRunner.execute());
    }

    @Test
    void execute_storageUnavailable_throwsException() {
        when(bootstrap.connect(store)).thenThrow(new StartupException(new IOException("share offline")));

        assertThrows(StartupException.class, () -> dashboardRunner.execute());
        verifyNoInteractions(dashboardService);
    }
}
