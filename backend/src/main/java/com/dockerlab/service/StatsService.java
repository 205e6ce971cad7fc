package com.dockerlab.service;

import com.dockerlab.config.AppProperties;
import com.dockerlab.config.ServerRuntime;
import com.dockerlab.dto.response.StatsResponse;
import com.dockerlab.model.StoreCounts;
import com.dockerlab.repository.StoreRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class StatsService {

    private final StoreRepository storeRepository;
    private final ServerRuntime serverRuntime;
    private final AppProperties appProperties;

    public StatsResponse collectStats() {
        StoreCounts counts = storeRepository.counts();
        String version = storeRepository.version();

        return new StatsResponse(true, StatsResponse.Stats.builder()
            .users(new StatsResponse.UserStats(counts.users()))
            .products(new StatsResponse.ProductStats(counts.products(), counts.totalStock()))
            .database(new StatsResponse.DatabaseStats(version, "active"))
            .api(StatsResponse.ApiStats.builder()
                .uptime(serverRuntime.formattedUptime())
                .startTime(serverRuntime.getStartTime())
                .environment(appProperties.environment())
                .memoryUsage(serverRuntime.heapUsedMb() + "MB")
                .build())
            .build());
    }
}
