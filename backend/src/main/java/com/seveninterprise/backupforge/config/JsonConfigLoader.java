package com.seveninterprise.backupforge.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.PropertySource;

/**
 * Configuração que carrega propriedades do arquivo backup-config.json
 *
 * Fonte de menor precedência: application.properties, variáveis de ambiente
 * e propriedades de sistema sobrescrevem estes valores.
 */
@Configuration
@PropertySource(value = "classpath:backup-config.json", factory = JsonPropertySourceFactory.class)
public class JsonConfigLoader {

    // Esta classe apenas registra o PropertySource do JSON
}
