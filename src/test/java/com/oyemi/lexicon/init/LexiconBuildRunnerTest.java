package com.oyemi.lexicon.init;

import com.oyemi.lexicon.config.LexiconProperties;
import com.oyemi.lexicon.dto.BuildSummary;
import com.oyemi.lexicon.dto.LexiconReport;
import com.oyemi.lexicon.dto.ValidationReport;
import com.oyemi.lexicon.service.ArtifactLocation;
import com.oyemi.lexicon.service.BuildReportWriter;
import com.oyemi.lexicon.service.LexiconBuildService;
import com.oyemi.lexicon.validation.ValidationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LexiconBuildRunnerTest {

    @Mock
    private LexiconBuildService buildService;

    @Mock
    private ValidationService validationService;

    @Mock
    private BuildReportWriter reportWriter;

    private LexiconProperties properties;
    private LexiconBuildRunner runner;
    private final ArtifactLocation location = new ArtifactLocation(Path.of("/tmp/lexicon"), false);

    @BeforeEach
    void setUp() {
        properties = new LexiconProperties();
        runner = new LexiconBuildRunner(properties, buildService, validationService, reportWriter, location);
    }

    @Test
    void testBuildThenValidate() {
        BuildSummary summary = BuildSummary.builder().artifact("/tmp/lexicon.mv.db").build();
        when(buildService.build()).thenReturn(summary);
        when(validationService.validate()).thenReturn(ValidationReport.builder().passed(true).build());

        runner.run();

        assertEquals(0, runner.getExitCode());
        ArgumentCaptor<LexiconReport> report = ArgumentCaptor.forClass(LexiconReport.class);
        verify(reportWriter).write(report.capture(), eq(location.reportFile()));
        assertSame(summary, report.getValue().getBuild());
    }

    @Test
    void testValidateModeSkipsBuildAndFailsExitCode() {
        properties.setMode(LexiconProperties.RunMode.VALIDATE);
        properties.setReportEnabled(false);
        when(validationService.validate()).thenReturn(ValidationReport.builder().passed(false).build());

        runner.run();

        assertEquals(1, runner.getExitCode());
        verifyNoInteractions(buildService);
        verify(reportWriter, never()).write(any(), any());
    }
}
