package dev.jobdesk.model;

import dev.jobdesk.exception.MultipleJobSelectionException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProjectKeysTest {

    @Test
    void drawingNumbersHaveThreeDashes() {
        assertThat(ProjectKeys.isDrawingNumber("105000-IMP-MACH-DTL")).isTrue();
        assertThat(ProjectKeys.isDrawingNumber("105000.177-43")).isFalse();
        assertThat(ProjectKeys.isDrawingNumber("105000-IMP-MACH-DTL (2)")).isTrue();
    }

    @Test
    void jobNumberIsTheKeyPrefix() {
        assertThat(ProjectKeys.jobNumberOf("105000.177-43")).isEqualTo("105000");
        assertThat(ProjectKeys.jobNumberOf("132068-CAS-WELD-DTL")).isEqualTo("132068");
    }

    @Test
    void singleJobNumberForOneJob() {
        assertThat(ProjectKeys.singleJobNumber(List.of("105000.1", "105000-A-B-C"))).isEqualTo("105000");
    }

    @Test
    void selectionSpanningJobsIsAmbiguous() {
        assertThatThrownBy(() -> ProjectKeys.singleJobNumber(List.of("105000.1", "105001.1")))
                .isInstanceOf(MultipleJobSelectionException.class)
                .hasMessageContaining("105000")
                .hasMessageContaining("105001");
    }

    @Test
    void filtersDrawingNumbers() {
        assertThat(ProjectKeys.drawingNumbers(List.of("105000.1", "105000-A-B-C", "105000-D-E-F")))
                .containsExactly("105000-A-B-C", "105000-D-E-F");
    }
}
