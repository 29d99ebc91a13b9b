package com.pipelineparser.controller;

import com.pipelineparser.model.dto.PipelineParseResponse;
import com.pipelineparser.model.dto.PipelineRequest;
import com.pipelineparser.service.PipelineService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

/**
 * Controller for pipeline submission from the editor.
 */
@RestController
@RequestMapping("/pipelines")
@RequiredArgsConstructor
public class PipelineController {

    private final PipelineService pipelineService;

    @PostMapping("/parse")
    public Mono<PipelineParseResponse> parsePipeline(@Valid @RequestBody PipelineRequest request) {
        return pipelineService.parsePipeline(request);
    }
}
