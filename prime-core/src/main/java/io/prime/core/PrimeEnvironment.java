package io.prime.core;

import io.prime.core.registry.DriverRegistry;
import io.prime.core.scorecard.ScorecardEngine;
import io.prime.core.scorecard.ScorecardGenerator;
import io.prime.core.scorecard.ScorecardRepository;
import io.prime.core.scorecard.ScorecardService;

/// Wired scorecard components created by {@link PrimeFactory}.
public final class PrimeEnvironment {

    private final DriverRegistry registry;
    private final ScorecardEngine engine;
    private final ScorecardGenerator generator;
    private final ScorecardRepository repository;
    private final ScorecardService service;

    public PrimeEnvironment(
            DriverRegistry registry,
            ScorecardEngine engine,
            ScorecardGenerator generator,
            ScorecardRepository repository,
            ScorecardService service) {
        this.registry = registry;
        this.engine = engine;
        this.generator = generator;
        this.repository = repository;
        this.service = service;
    }

    public DriverRegistry getRegistry() {
        return registry;
    }

    public ScorecardEngine getEngine() {
        return engine;
    }

    public ScorecardGenerator getGenerator() {
        return generator;
    }

    public ScorecardRepository getRepository() {
        return repository;
    }

    public ScorecardService getService() {
        return service;
    }
}
