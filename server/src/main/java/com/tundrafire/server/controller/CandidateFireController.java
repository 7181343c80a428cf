package com.tundrafire.server.controller;

import com.tundrafire.db.ExportRecord;
import com.tundrafire.server.pipeline.PipelineResult;
import com.tundrafire.server.pipeline.ProbabilityColorRamp;
import com.tundrafire.server.pipeline.RunConfiguration;
import com.tundrafire.server.service.CandidateFireService;
import com.tundrafire.server.vector.ExportOutcome;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.WKTReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

@RestController
public class CandidateFireController {

    private static final Logger logger = LoggerFactory.getLogger(CandidateFireController.class);
    private final CandidateFireService fireService;

    public CandidateFireController(CandidateFireService fireService) {
        this.fireService = fireService;
    }

    public static class CandidateFireRequest {
        public int year;
        // WKT polygon; the default study region is used when absent
        public String roi;
        public boolean export;
    }

    public static class CandidateFireResponse {
        public int year;
        public String mode;
        public int observations;
        public int candidatePixels;
        public List<String> exports = new ArrayList<>();
    }

    @PostMapping("/candidate-fires")
    public ResponseEntity<?> detect(@RequestBody CandidateFireRequest request) {
        if (!fireService.isReady()) {
            return ResponseEntity.status(503).body("Pipeline is still loading, please try again later.");
        }
        RunConfiguration run;
        try {
            run = toRun(request);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(e.getMessage());
        }

        logger.info("Received candidate fire request for {}", run);
        PipelineResult result;
        try {
            result = fireService.run(run);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(e.getMessage());
        }

        CandidateFireResponse response = new CandidateFireResponse();
        response.year = run.getYear();
        response.mode = run.getMode().name();
        response.observations = result.getObservationCount();
        response.candidatePixels = result.getCandidatePixelCount();
        for (ExportOutcome outcome : result.getExports()) {
            response.exports.add(outcome.getName());
        }
        return ResponseEntity.ok(response);
    }

    @PostMapping("/candidate-fires/probability.png")
    public ResponseEntity<?> probabilityQuicklook(@RequestBody CandidateFireRequest request) throws IOException {
        if (!fireService.isReady()) {
            return ResponseEntity.status(503).body("Pipeline is still loading, please try again later.");
        }
        if (request.roi == null || request.roi.isBlank()) {
            return ResponseEntity.badRequest().body("The probability quicklook needs a drawn ROI polygon.");
        }
        PipelineResult result;
        try {
            request.export = false;
            result = fireService.run(toRun(request));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(e.getMessage());
        }

        ByteArrayOutputStream png = new ByteArrayOutputStream();
        ProbabilityColorRamp.writePng(result.getArea().getProbability(), png);
        return ResponseEntity.ok().contentType(MediaType.IMAGE_PNG).body(png.toByteArray());
    }

    @GetMapping("/candidate-fires/exports")
    public ResponseEntity<?> exports(@RequestParam("year") int year) {
        if (!fireService.isReady()) {
            return ResponseEntity.status(503).body("Pipeline is still loading, please try again later.");
        }
        List<ExportRecord> records = fireService.exportsForYear(year);
        return ResponseEntity.ok(records);
    }

    private RunConfiguration toRun(CandidateFireRequest request) {
        if (request.roi == null || request.roi.isBlank()) {
            return RunConfiguration.defaultRegion(request.year, fireService.getDefaultRegion(), request.export);
        }
        Geometry roi;
        try {
            roi = new WKTReader().read(request.roi);
        } catch (ParseException e) {
            throw new IllegalArgumentException("Invalid ROI polygon: " + e.getMessage(), e);
        }
        return RunConfiguration.drawn(request.year, roi, request.export);
    }
}
