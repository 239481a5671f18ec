package com.architecture.memory.traceback.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.neo4j.repository.config.EnableNeo4jRepositories;

@Configuration
@EnableNeo4jRepositories(basePackages = "com.architecture.memory.traceback.repository.graph")
public class Neo4jConfig {
}
