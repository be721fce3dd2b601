package com.example.cruscotto.interfaces.api;

import com.example.cruscotto.application.service.PipelineService;
import com.example.cruscotto.domain.model.PipelineReport;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Manual triggers for the batch pipeline. Both calls block until the run completes.
 */
@RestController
@RequestMapping(value = "/api/pipeline", produces = MediaType.APPLICATION_JSON_VALUE)
public class PipelineController {

    private final PipelineService pipelineService;

    public PipelineController(PipelineService pipelineService) {
        this.pipelineService = pipelineService;
    }

    @PostMapping("/run")
    public PipelineReport runFull() {
        return pipelineService.runFull();
    }

    @PostMapping("/update")
    public PipelineReport runMonthlyUpdate() {
        return pipelineService.runMonthlyUpdate();
    }
}
