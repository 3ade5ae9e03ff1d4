package io.intellixity.semantiq.server.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.intellixity.semantiq.governance.GovernedQueryService;
import io.intellixity.semantiq.jdbc.JdbcCatalogStore;
import io.intellixity.semantiq.jdbc.JdbcPlanExecutor;
import io.intellixity.semantiq.jdbc.JdbcShareGrantStore;
import io.intellixity.semantiq.planner.catalog.CatalogLoader;
import io.intellixity.semantiq.planner.catalog.CatalogStore;
import io.intellixity.semantiq.planner.catalog.RelationshipValidator;
import io.intellixity.semantiq.planner.plan.PlanExecutor;
import io.intellixity.semantiq.planner.plan.SemanticQueryPlanner;
import io.intellixity.semantiq.planner.plan.SemanticQueryService;
import io.intellixity.semantiq.planner.security.ShareGrantStore;
import io.intellixity.semantiq.planner.security.SharePolicyResolver;
import io.intellixity.semantiq.security.RlsConfigParser;
import io.intellixity.semantiq.spi.sql.DiscoveredDialectRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

@Configuration
@EnableConfigurationProperties(SemantiqProperties.class)
public class SemantiqServerConfig {
  private static final Logger log = LoggerFactory.getLogger(SemantiqServerConfig.class);

  @Bean
  public HikariDataSource dataSource(SemantiqProperties props) {
    SemantiqProperties.Datasource db = props.getDatasource();
    if (db.getJdbcUrl() == null || db.getJdbcUrl().isBlank()) {
      throw new IllegalStateException("Missing semantiq.datasource.jdbc-url");
    }
    HikariConfig hc = new HikariConfig();
    hc.setJdbcUrl(db.getJdbcUrl());
    hc.setUsername(db.getUsername());
    hc.setPassword(db.getPassword());
    hc.setMaximumPoolSize(db.getMaximumPoolSize());
    return new HikariDataSource(hc);
  }

  @Bean
  public CatalogStore catalogStore(DataSource dataSource, ObjectMapper objectMapper) {
    return new JdbcCatalogStore(dataSource, objectMapper);
  }

  @Bean
  public ShareGrantStore shareGrantStore(DataSource dataSource, ObjectMapper objectMapper) {
    return new JdbcShareGrantStore(dataSource, objectMapper);
  }

  @Bean
  public PlanExecutor planExecutor(DataSource dataSource, SemantiqProperties props) {
    return new JdbcPlanExecutor(dataSource, props.getExecution().getQueryTimeoutSeconds());
  }

  @Bean
  public DiscoveredDialectRegistry dialectRegistry() {
    DiscoveredDialectRegistry registry = new DiscoveredDialectRegistry();
    log.info("semantiq.server op=dialects engines={}", registry.engines());
    return registry;
  }

  @Bean
  public CatalogLoader catalogLoader(CatalogStore catalogStore) {
    return new CatalogLoader(catalogStore);
  }

  @Bean
  public SemanticQueryPlanner semanticQueryPlanner(CatalogLoader catalogLoader,
                                                   ShareGrantStore shareGrantStore,
                                                   DiscoveredDialectRegistry dialects,
                                                   ObjectMapper objectMapper,
                                                   SemantiqProperties props) {
    SharePolicyResolver policies = new SharePolicyResolver(shareGrantStore, new RlsConfigParser(objectMapper));
    return new SemanticQueryPlanner(catalogLoader, policies, dialects, props.getPlanner().toConfig());
  }

  @Bean
  public SemanticQueryService semanticQueryService(SemanticQueryPlanner planner,
                                                   PlanExecutor executor,
                                                   CatalogLoader catalogLoader,
                                                   CatalogStore catalogStore) {
    return new SemanticQueryService(planner, executor, catalogLoader, catalogStore, new RelationshipValidator());
  }

  @Bean
  public GovernedQueryService governedQueryService(SemanticQueryService service) {
    return new GovernedQueryService(service);
  }
}
