package com.eainde.xrf.controller;

import com.eainde.xrf.exception.XrfProcessingException;
import com.eainde.xrf.job.FileParseReport;
import com.eainde.xrf.job.JobProcessingResult;
import com.eainde.xrf.job.UploadedSheet;
import com.eainde.xrf.job.XrfJobService;
import com.eainde.xrf.model.AreaType;
import com.eainde.xrf.parse.ParseError;
import com.eainde.xrf.parse.ParseMetadata;
import com.eainde.xrf.summary.DatasetSummary;
import com.eainde.xrf.summary.JobSummary;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(XrfJobController.class)
class XrfJobControllerTest {

    @Autowired private MockMvc mockMvc;

    @MockBean private XrfJobService jobService;

    private static final MockMultipartFile UNITS = new MockMultipartFile(
            "units", "units.csv", "text/csv", "Reading #,Component,Color,PbC\n1,Door,White,0.2\n".getBytes());

    @Test
    @DisplayName("returns the job summary")
    void summary() throws Exception {
        JobSummary summary = new JobSummary("J-1", Instant.parse("2024-06-01T12:00:00Z"), "units.csv", 0,
                DatasetSummary.empty(AreaType.COMMON_AREA), DatasetSummary.empty(AreaType.UNITS), null);
        when(jobService.process(eq("J-1"), any(), any())).thenReturn(new JobProcessingResult(summary, List.of()));

        mockMvc.perform(multipart("/api/jobs/J-1/summary").file(UNITS))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.jobNumber").value("J-1"))
                .andExpect(jsonPath("$.processedDate").value("2024-06-01T12:00:00Z"))
                .andExpect(jsonPath("$.unitsSummary.totalReadings").value(0));

        ArgumentCaptor<UploadedSheet> units = ArgumentCaptor.forClass(UploadedSheet.class);
        verify(jobService).process(eq("J-1"), isNull(), units.capture());
        assertThat(units.getValue().fileName()).isEqualTo("units.csv");
        assertThat(units.getValue().open().readAllBytes()).isEqualTo(UNITS.getBytes());
    }

    @Test
    @DisplayName("answers 422 with the reasons when a file cannot be parsed")
    void parseFailure() throws Exception {
        FileParseReport report = new FileParseReport("units.csv", AreaType.UNITS, ParseMetadata.empty("units"),
                List.of(), List.of(ParseError.ofSheet("No data found in worksheet")));
        when(jobService.process(eq("J-2"), any(), any())).thenReturn(new JobProcessingResult(null, List.of(report)));

        mockMvc.perform(multipart("/api/jobs/J-2/summary").file(UNITS))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.jobNumber").value("J-2"))
                .andExpect(jsonPath("$.errors[0]").value("units.csv: No data found in worksheet"))
                .andExpect(jsonPath("$.files[0].areaType").value("UNITS"));
    }

    @Test
    @DisplayName("answers 400 when the job is rejected")
    void rejected() throws Exception {
        when(jobService.process(eq("J-3"), any(), any()))
                .thenThrow(new XrfProcessingException("Job J-3 has no spreadsheet to process"));

        mockMvc.perform(multipart("/api/jobs/J-3/summary"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Job J-3 has no spreadsheet to process"));
    }
}
