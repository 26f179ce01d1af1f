package com.peargent.serialization;

import com.peargent.routing.RouterDescriptor;

import java.util.List;

public record PoolDescriptor(List<String> agents, RouterDescriptor router, int maxIter, Boolean tracing) {
    public PoolDescriptor {
        agents = agents != null ? List.copyOf(agents) : List.of();
        router = router != null ? router : RouterDescriptor.stop();
    }
}
