package com.seveninterprise.backupforge.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.env.MapPropertySource;
import org.springframework.core.env.PropertySource;
import org.springframework.core.io.support.EncodedResource;
import org.springframework.core.io.support.PropertySourceFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Factory para criar PropertySource a partir de um arquivo JSON
 *
 * Objetos aninhados viram chaves com ponto e arrays viram chaves indexadas
 * ({@code backup.files.directories[0]}), o formato esperado pelo binder
 * de {@code @ConfigurationProperties}.
 */
public class JsonPropertySourceFactory implements PropertySourceFactory {

    private static final Logger logger = LoggerFactory.getLogger(JsonPropertySourceFactory.class);

    @Override
    public PropertySource<?> createPropertySource(String name, EncodedResource resource) throws IOException {
        Map<String, Object> properties = new LinkedHashMap<>();
        String sourceName = name != null ? name : resource.getResource().getDescription();

        try (InputStream input = resource.getInputStream()) {
            JsonNode rootNode = new ObjectMapper().readTree(input);
            if (rootNode != null) {
                loadNodeProperties(rootNode, properties, "");
            }
            logger.info("✅ Carregadas {} propriedades de {}", properties.size(), sourceName);
        } catch (IOException e) {
            logger.error("❌ Erro ao carregar {}: {}", sourceName, e.getMessage());
            throw new IOException("Falha ao carregar " + sourceName, e);
        }

        return new MapPropertySource(sourceName, properties);
    }

    static void loadNodeProperties(JsonNode node, Map<String, Object> properties, String prefix) {
        if (node.isObject()) {
            node.fields().forEachRemaining(entry -> {
                String key = prefix.isEmpty() ? entry.getKey() : prefix + "." + entry.getKey();
                loadNodeProperties(entry.getValue(), properties, key);
            });
        } else if (node.isArray()) {
            for (int i = 0; i < node.size(); i++) {
                loadNodeProperties(node.get(i), properties, prefix + "[" + i + "]");
            }
        } else if (node.isNull()) {
            // ausência de valor: mantém o padrão do binder
        } else if (node.isBoolean()) {
            properties.put(prefix, node.asBoolean());
        } else if (node.isInt()) {
            properties.put(prefix, node.asInt());
        } else if (node.isLong()) {
            properties.put(prefix, node.asLong());
        } else if (node.isNumber()) {
            properties.put(prefix, node.asDouble());
        } else {
            properties.put(prefix, node.asText());
        }
    }
}
