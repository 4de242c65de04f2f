package com.bbthechange.mealvoting.controller;

import com.bbthechange.mealvoting.repository.ChainRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HealthController {

    private final ChainRepository chainRepository;

    @Autowired
    public HealthController(ChainRepository chainRepository) {
        this.chainRepository = chainRepository;
    }

    @GetMapping("/health")
    public String health() {
        return "OK: " + chainRepository.count() + " chains";
    }
}
