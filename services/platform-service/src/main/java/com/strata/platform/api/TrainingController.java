package com.strata.platform.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.strata.platform.application.training.TrainingRequest;
import com.strata.platform.application.training.TrainingService;
import com.strata.security.Principal;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/ml")
public class TrainingController {

    private final TrainingService trainingService;

    public TrainingController(TrainingService trainingService) {
        this.trainingService = trainingService;
    }

    /**
     * Relays the training service's answer verbatim.
     */
    @PostMapping("/train")
    public JsonNode train(Principal principal, @RequestBody TrainingRequest request) {
        return trainingService.train(principal, request);
    }
}
