package com.architecture.codeflow.controller;

import com.architecture.codeflow.dto.FlowchartOptions;
import com.architecture.codeflow.dto.FlowchartRequest;
import com.architecture.codeflow.dto.FlowchartResponse;
import com.architecture.codeflow.exception.SourceParseException;
import com.architecture.codeflow.service.FlowchartService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller turning Java source into flowchart.js DSL.
 */
@RestController
@RequestMapping("/api/flowcharts")
@RequiredArgsConstructor
@Slf4j
public class FlowchartController {

    private final FlowchartService flowchartService;
    private final FlowchartOptions defaultFlowchartOptions;

    /**
     * Generate the flowchart of a method, class or statement snippet.
     * Returns 400 when the source cannot be parsed.
     */
    @PostMapping
    public ResponseEntity<FlowchartResponse> generateFlowchart(@Valid @RequestBody FlowchartRequest request) {
        log.info("Flowchart requested for field '{}' ({} chars of source)", request.getField(), request.getCode().length());
        try {
            FlowchartResponse response = flowchartService.generate(request);
            log.info("Flowchart generated: {} nodes, {} connections", response.getNodeCount(), response.getConnectionCount());
            return ResponseEntity.ok(response);
        } catch (SourceParseException e) {
            log.warn("Rejecting flowchart request: {}", e.getMessage());
            return ResponseEntity.badRequest()
                    .body(FlowchartResponse.builder()
                            .field(request.getField())
                            .error(e.getMessage())
                            .build());
        }
    }

    @GetMapping("/defaults")
    public ResponseEntity<FlowchartOptions> getDefaults() {
        return ResponseEntity.ok(defaultFlowchartOptions);
    }
}
