package com.peargent.serialization;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.peargent.agent.Agent;
import com.peargent.pool.Pool;
import com.peargent.routing.RouterDescriptor;
import com.peargent.tools.Tool;
import com.peargent.tools.ToolParameter;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;

/**
 * Converts a {@link Pool} into a {@link PearPackage} and reads or writes packages as
 * snake_case JSON.
 */
public class PackageSerializer {

    private final ObjectMapper mapper = new ObjectMapper()
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    public ObjectMapper mapper() { return mapper; }

    public PearPackage toPackage(Pool pool) {
        var tools = new LinkedHashMap<String, ToolDescriptor>();
        var agents = new ArrayList<AgentDescriptor>();
        for (var agent : pool.agents().values()) {
            for (var tool : agent.tools()) tools.putIfAbsent(tool.name(), describe(tool));
            agents.add(describe(agent));
        }
        var router = pool.router().describe();
        if (RouterDescriptor.CUSTOM.equals(router.type()) && (router.name() == null || router.name().isBlank())) {
            throw new IllegalArgumentException(
                    "Custom router has no name; wrap it with Routers.named(name, router) before serializing");
        }
        var poolDescriptor = new PoolDescriptor(pool.agentNames(), router, pool.maxIter(), pool.tracing());
        return new PearPackage(new ArrayList<>(tools.values()), agents, poolDescriptor);
    }

    public String writeString(PearPackage pkg) {
        try {
            return mapper.writeValueAsString(pkg);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize package", e);
        }
    }

    public PearPackage readString(String json) {
        try {
            return mapper.readValue(json, PearPackage.class);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Invalid package JSON: " + e.getOriginalMessage(), e);
        }
    }

    public void write(PearPackage pkg, Path file) throws IOException {
        var parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        mapper.writeValue(file.toFile(), pkg);
    }

    public PearPackage read(Path file) throws IOException {
        return mapper.readValue(file.toFile(), PearPackage.class);
    }

    static ToolDescriptor describe(Tool tool) {
        var params = new ArrayList<ParameterDescriptor>();
        for (ToolParameter p : tool.parameters()) {
            params.add(new ParameterDescriptor(p.name(), p.type().wireName(), p.description(),
                    p.required(), p.defaultValue()));
        }
        return new ToolDescriptor(tool.name(), tool.description(), params,
                tool.timeout() != null ? seconds(tool.timeout()) : null,
                tool.maxRetries(), seconds(tool.retryDelay()), tool.retryBackoff(),
                tool.onError().wireName());
    }

    static AgentDescriptor describe(Agent agent) {
        var toolNames = new ArrayList<String>();
        for (var tool : agent.tools()) toolNames.add(tool.name());
        return new AgentDescriptor(agent.name(), agent.description(), agent.persona(), toolNames,
                agent.tracingSetting(), agent.maxToolRounds(),
                agent.modelTimeout() != null ? seconds(agent.modelTimeout()) : null);
    }

    private static double seconds(Duration d) {
        return d.toMillis() / 1000.0;
    }
}
