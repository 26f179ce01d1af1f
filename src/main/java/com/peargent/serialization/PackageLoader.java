package com.peargent.serialization;

import com.peargent.agent.Agent;
import com.peargent.pool.Pool;
import com.peargent.providers.EmbeddingProvider;
import com.peargent.providers.ModelProvider;
import com.peargent.routing.Router;
import com.peargent.routing.RouterDescriptor;
import com.peargent.routing.Routers;
import com.peargent.routing.RoutingAgent;
import com.peargent.routing.SemanticRouter;
import com.peargent.shared.config.ToolsConfig;
import com.peargent.tools.BuiltinTools;
import com.peargent.tools.ErrorPolicy;
import com.peargent.tools.ParamType;
import com.peargent.tools.Tool;
import com.peargent.tools.ToolBuilder;
import com.peargent.tools.ToolFunction;
import com.peargent.tools.ToolParameter;
import com.peargent.tools.ToolRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Rebuilds a runnable {@link Pool} from a package. Tool functions and custom routers
 * cannot be serialized, so callers supply them by name; built-in tools resolve
 * without help.
 */
public class PackageLoader {

    private static final Logger log = LoggerFactory.getLogger(PackageLoader.class);

    public static Pool load(PearPackage pkg, Map<String, ToolFunction> toolFunctions,
                            ModelProvider defaultModel, Map<String, Router> customRouters) {
        return load(pkg, toolFunctions, defaultModel, null, customRouters);
    }

    public static Pool load(PearPackage pkg, Map<String, ToolFunction> toolFunctions, ModelProvider defaultModel,
                            EmbeddingProvider embeddings, Map<String, Router> customRouters) {
        if (pkg.pool() == null) {
            throw new IllegalArgumentException("Package has no pool section");
        }
        var functions = toolFunctions != null ? toolFunctions : Map.<String, ToolFunction>of();
        var routers = customRouters != null ? customRouters : Map.<String, Router>of();

        var tools = new ToolRegistry();
        for (var descriptor : pkg.tools()) {
            tools.register(buildTool(descriptor, functions));
        }

        var agents = new HashMap<String, Agent>();
        for (var descriptor : pkg.agents()) {
            agents.put(descriptor.name(), buildAgent(descriptor, tools));
        }

        var poolAgents = new ArrayList<Agent>();
        for (var name : pkg.pool().agents()) {
            var agent = agents.get(name);
            if (agent == null) {
                throw new IllegalArgumentException("Pool references undefined agent '" + name + "'");
            }
            poolAgents.add(agent);
        }

        var builder = Pool.builder()
                .agents(poolAgents)
                .defaultModel(defaultModel)
                .maxIter(pkg.pool().maxIter())
                .router(buildRouter(pkg.pool().router(), poolAgents, defaultModel, embeddings, routers));
        if (pkg.pool().tracing() != null) builder.tracing(pkg.pool().tracing());
        var pool = builder.build();
        log.info("Loaded package: {} agent(s), tools {}, router {}", poolAgents.size(), tools.names(),
                pkg.pool().router().type());
        return pool;
    }

    static Tool buildTool(ToolDescriptor d, Map<String, ToolFunction> functions) {
        ToolBuilder builder;
        var function = functions.get(d.name());
        if (function != null) {
            builder = ToolBuilder.builder(d.name()).function(function);
        } else if (BuiltinTools.AVAILABLE.contains(d.name())) {
            builder = ToolBuilder.from(BuiltinTools.create(d.name(), ToolsConfig.standard()));
        } else {
            throw new IllegalArgumentException("No function registered for tool '" + d.name() + "'");
        }

        var params = new ArrayList<ToolParameter>();
        for (var p : d.parameters()) {
            var type = p.type() != null ? ParamType.parse(p.type()) : ParamType.ANY;
            params.add(new ToolParameter(p.name(), type, p.description(), p.required(), p.defaultValue()));
        }
        builder.description(d.description())
                .parameters(params)
                .timeout(null)
                .maxRetries(d.maxRetries())
                .retryDelaySeconds(d.retryDelay())
                .retryBackoff(d.retryBackoff())
                .onError(ErrorPolicy.parse(d.onError()));
        if (d.timeout() != null) builder.timeoutSeconds(d.timeout());
        return builder.build();
    }

    static Agent buildAgent(AgentDescriptor d, ToolRegistry tools) {
        var builder = Agent.builder(d.name()).description(d.description()).persona(d.persona());
        for (var toolName : d.tools()) {
            builder.tool(tools.find(toolName).orElseThrow(() -> new IllegalArgumentException(
                    "Agent '" + d.name() + "' references undefined tool '" + toolName + "'")));
        }
        if (d.tracing() != null) builder.tracing(d.tracing());
        if (d.maxToolRounds() != null) builder.maxToolRounds(d.maxToolRounds());
        if (d.modelTimeout() != null) builder.modelTimeout(Duration.ofMillis(Math.round(d.modelTimeout() * 1000)));
        return builder.build();
    }

    static Router buildRouter(RouterDescriptor d, List<Agent> agents, ModelProvider defaultModel,
                              EmbeddingProvider embeddings, Map<String, Router> customRouters) {
        return switch (d.type()) {
            case RouterDescriptor.STOP -> Routers.stop();
            case RouterDescriptor.ROUND_ROBIN -> Routers.roundRobin(d.agents());
            case RouterDescriptor.ROUTING_AGENT -> {
                if (defaultModel == null) {
                    throw new IllegalArgumentException("Routing agent '" + d.name() + "' needs a default model");
                }
                yield Routers.adapt(new RoutingAgent(d.name(), d.persona(), defaultModel, d.agents()));
            }
            case RouterDescriptor.SEMANTIC -> {
                if (customRouters.containsKey(d.name())) yield customRouters.get(d.name());
                if (embeddings == null) {
                    throw new IllegalArgumentException("Semantic router '" + d.name() + "' needs an embedding provider");
                }
                var routed = agents.stream().filter(a -> d.agents() == null || d.agents().contains(a.name())).toList();
                yield Routers.adapt(new SemanticRouter(d.name(), embeddings, routed));
            }
            case RouterDescriptor.CUSTOM -> {
                var router = customRouters.get(d.name());
                if (router == null) {
                    throw new IllegalArgumentException("Custom router '" + d.name() + "' is not registered");
                }
                yield d.equals(router.describe()) ? router : Routers.named(d.name(), router);
            }
            default -> throw new IllegalArgumentException("Unknown router type '" + d.type() + "'");
        };
    }
}
