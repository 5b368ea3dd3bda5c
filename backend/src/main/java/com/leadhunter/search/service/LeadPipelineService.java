package com.leadhunter.search.service;

import com.leadhunter.search.model.LeadSearchRequest;
import com.leadhunter.search.model.LeadSearchResult;
import org.springframework.stereotype.Service;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

@Service
public class LeadPipelineService {
    private final LeadGeneratorFactory generatorFactory;
    private final Set<LeadGenerator> running = ConcurrentHashMap.newKeySet();

    public LeadPipelineService(LeadGeneratorFactory generatorFactory) {
        this.generatorFactory = generatorFactory;
    }

    public LeadSearchResult run(LeadSearchRequest request) {
        try (LeadGenerator generator = generatorFactory.create()) {
            running.add(generator);
            try {
                return generator.generate(request);
            } finally {
                running.remove(generator);
            }
        }
    }

    /**
     * @return number of runs that were asked to stop
     */
    public int cancelAll() {
        int cancelled = 0;
        for (LeadGenerator generator : running) {
            generator.cancel();
            cancelled++;
        }
        return cancelled;
    }
}
