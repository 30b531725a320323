package com.edge.align.controller;

import com.edge.align.config.YamlConfig;
import com.edge.align.core.AlignmentException;
import com.edge.align.core.AlignmentSettings;
import com.edge.align.core.cascade.StrategyCascade;
import com.edge.align.core.model.AlignmentResult;
import com.edge.align.core.model.HomographyMatrix;
import com.edge.align.core.model.MatchingRegion;
import com.edge.align.core.model.Offset;
import com.edge.align.core.model.StrategyId;
import com.edge.align.dto.AlignRequest;
import com.edge.align.dto.AlignResponse;
import com.edge.align.dto.BatchAlignRequest;
import com.edge.align.dto.BatchAlignResponse;
import com.edge.align.model.AlignmentRecord;
import com.edge.align.repository.AlignmentRecordRepository;
import com.edge.align.service.AlignmentService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDate;
import java.util.Collections;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AlignmentController.class)
class AlignmentControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AlignmentService alignmentService;

    @MockBean
    private AlignmentRecordRepository recordRepository;

    @MockBean
    private StrategyCascade strategyCascade;

    @MockBean
    private AlignmentSettings alignmentSettings;

    @MockBean
    private YamlConfig yamlConfig;

    @BeforeEach
    void setUp() {
        when(strategyCascade.getSteps()).thenReturn(StrategyCascade.standard(null).getSteps());
        when(alignmentSettings.getFeatureConfidence()).thenReturn(0.3);
        when(alignmentSettings.getEdgeThreshold()).thenReturn(1000.0);
        when(alignmentSettings.getCropThreshold()).thenReturn(5000.0);
        when(alignmentSettings.getMultiScaleThreshold()).thenReturn(1000.0);
    }

    private static final String ALIGN_BODY = "{\"referencePath\":\"ref.png\",\"targetPath\":\"home.png\"}";

    @Test
    void alignReturnsOffsetAndRegion() throws Exception {
        AlignmentResult result = new AlignmentResult("out.png", new Offset(20, -10),
            new MatchingRegion(20, 0, 780, 590), StrategyId.DIRECT_SUBIMAGE, 0.0, null);
        when(alignmentService.align(any(AlignRequest.class))).thenReturn(AlignResponse.from(result, 86));

        mockMvc.perform(post("/api/align").contentType(MediaType.APPLICATION_JSON).content(ALIGN_BODY))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("success"))
            .andExpect(jsonPath("$.data.offset.x").value(20))
            .andExpect(jsonPath("$.data.offset.y").value(-10))
            .andExpect(jsonPath("$.data.matchingRegion.width").value(780))
            .andExpect(jsonPath("$.data.method").value("target-in-ref"))
            .andExpect(jsonPath("$.data.transform").doesNotExist());
    }

    @Test
    void featureResultIncludesTransform() throws Exception {
        AlignmentResult result = new AlignmentResult("out.png", new Offset(10, 20),
            new MatchingRegion(10, 20, 790, 580), StrategyId.FEATURE_HOMOGRAPHY, 0.1,
            HomographyMatrix.translation(10, 20).decompose());
        when(alignmentService.align(any(AlignRequest.class))).thenReturn(AlignResponse.from(result, 120));

        mockMvc.perform(post("/api/align").contentType(MediaType.APPLICATION_JSON).content(ALIGN_BODY))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.method").value("opencv-feature"))
            .andExpect(jsonPath("$.data.transform.translationX").value(10.0))
            .andExpect(jsonPath("$.data.transform.scaleX").value(1.0));
    }

    @Test
    void invalidRequestIsBadRequest() throws Exception {
        when(alignmentService.align(any(AlignRequest.class)))
            .thenThrow(new IllegalArgumentException("Invalid alignment method: magic"));

        mockMvc.perform(post("/api/align").contentType(MediaType.APPLICATION_JSON).content(ALIGN_BODY))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.status").value("error"))
            .andExpect(jsonPath("$.message").value("Invalid alignment method: magic"));
    }

    @Test
    void alignmentFailureIsServerError() throws Exception {
        when(alignmentService.align(any(AlignRequest.class)))
            .thenThrow(new AlignmentException("Failed to write aligned image to out.png"));

        mockMvc.perform(post("/api/align").contentType(MediaType.APPLICATION_JSON).content(ALIGN_BODY))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.status").value("error"));
    }

    @Test
    void batchReturnsPerPairResults() throws Exception {
        BatchAlignResponse response = new BatchAlignResponse();
        response.setBatchId("batch-1a2b3c4d");
        response.setTotal(1);
        response.setFailed(1);
        response.getResults().add(BatchAlignResponse.PairResult.failed(0,
            new AlignRequest("ref.png", "b.png"), "Target image not found: b.png"));
        when(alignmentService.alignBatch(any(BatchAlignRequest.class))).thenReturn(response);

        mockMvc.perform(post("/api/align/batch").contentType(MediaType.APPLICATION_JSON)
                .content("{\"pairs\":[{\"referencePath\":\"ref.png\",\"targetPath\":\"b.png\"}]}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.batchId").value("batch-1a2b3c4d"))
            .andExpect(jsonPath("$.data.failed").value(1))
            .andExpect(jsonPath("$.data.results[0].status").value("failed"));
    }

    @Test
    void emptyBatchIsBadRequest() throws Exception {
        when(alignmentService.alignBatch(any(BatchAlignRequest.class)))
            .thenThrow(new IllegalArgumentException("Batch must contain at least one pair"));

        mockMvc.perform(post("/api/align/batch").contentType(MediaType.APPLICATION_JSON).content("{\"pairs\":[]}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void strategiesAreListedInCascadeOrder() throws Exception {
        mockMvc.perform(get("/api/align/strategies"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.length()").value(7))
            .andExpect(jsonPath("$.data[0].key").value("opencv-feature"))
            .andExpect(jsonPath("$.data[0].threshold").value(0.3))
            .andExpect(jsonPath("$.data[1].key").value("target-in-ref"))
            .andExpect(jsonPath("$.data[2].invertOffset").value(true))
            .andExpect(jsonPath("$.data[4].key").value("cropped-region"))
            .andExpect(jsonPath("$.data[4].threshold").value(5000.0))
            .andExpect(jsonPath("$.data[6].key").value("phase-correlation"));
    }

    @Test
    void recordsByDateAndBatch() throws Exception {
        AlignmentRecord record = new AlignmentRecord();
        record.setId("r1");
        record.setMethod("edge-based");
        when(recordRepository.findByDate(LocalDate.of(2024, 1, 15))).thenReturn(Collections.singletonList(record));
        when(recordRepository.findByBatchId("batch-1a2b3c4d")).thenReturn(Collections.singletonList(record));

        mockMvc.perform(get("/api/align/records").param("date", "2024-01-15"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data[0].method").value("edge-based"));
        mockMvc.perform(get("/api/align/records").param("batchId", "batch-1a2b3c4d"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data[0].id").value("r1"));
        mockMvc.perform(get("/api/align/records").param("date", "15/01/2024"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void recordById() throws Exception {
        AlignmentRecord record = new AlignmentRecord();
        record.setId("r1");
        when(recordRepository.findById("r1")).thenReturn(Optional.of(record));
        when(recordRepository.findById("missing")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/align/records/r1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.id").value("r1"));
        mockMvc.perform(get("/api/align/records/missing"))
            .andExpect(status().isNotFound());
    }
}
