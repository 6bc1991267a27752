package com.example.investigator.config;

import com.example.investigator.service.EmbeddedLogIndex;
import com.example.investigator.tools.LogSearchTool;
import com.example.investigator.tools.McpBridgeTool;
import com.example.investigator.tools.ToolCapability;
import com.example.investigator.tools.ToolCatalog;
import com.example.investigator.tools.ToolServer;
import java.net.http.HttpClient;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

@Configuration
public class ToolsConfig {

    private static final Logger log = LoggerFactory.getLogger(ToolsConfig.class);

    @Bean
    public ToolCatalog toolCatalog(
            InvestigationProperties properties,
            EmbeddedLogIndex logIndex,
            RestClient.Builder restClientBuilder) {
        InvestigationProperties.Tools settings = properties.tools();
        Map<ToolServer, RestClient> clients = new EnumMap<>(ToolServer.class);
        for (ToolServer server : ToolServer.values()) {
            String baseUrl = settings.servers().get(server.id());
            if (server == ToolServer.LOCAL) {
                continue;
            }
            if (!StringUtils.hasText(baseUrl)) {
                log.warn(">>> No URL for tool server '{}', its tools will fail fast", server.id());
                continue;
            }
            clients.put(server, bridgeClient(restClientBuilder.clone(), baseUrl, settings));
        }

        List<ToolCapability> tools = new ArrayList<>();
        for (ToolCatalog.ToolSpec spec : ToolCatalog.SPECS) {
            if (spec.server() == ToolServer.LOCAL) {
                continue;
            }
            tools.add(new McpBridgeTool(spec.name(), spec.server(), clients.get(spec.server())));
        }
        tools.add(new LogSearchTool(logIndex));
        return new ToolCatalog(tools);
    }

    private static RestClient bridgeClient(
            RestClient.Builder builder, String baseUrl, InvestigationProperties.Tools settings) {
        HttpClient httpClient =
                HttpClient.newBuilder().connectTimeout(settings.callTimeout()).build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(settings.callTimeout());

        builder.baseUrl(baseUrl).requestFactory(requestFactory);
        if (StringUtils.hasText(settings.token())) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + settings.token());
        }
        return builder.build();
    }
}
