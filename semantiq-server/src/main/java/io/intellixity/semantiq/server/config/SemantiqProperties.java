package io.intellixity.semantiq.server.config;

import io.intellixity.semantiq.config.PlannerConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "semantiq")
public class SemantiqProperties {
  private final Datasource datasource = new Datasource();
  private final Planner planner = new Planner();
  private final Execution execution = new Execution();

  public Datasource getDatasource() { return datasource; }
  public Planner getPlanner() { return planner; }
  public Execution getExecution() { return execution; }

  /** Metadata store and row-store backend (one Postgres database). */
  public static class Datasource {
    private String jdbcUrl;
    private String username;
    private String password;
    private int maximumPoolSize = 10;

    public String getJdbcUrl() { return jdbcUrl; }
    public void setJdbcUrl(String jdbcUrl) { this.jdbcUrl = jdbcUrl; }
    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }
    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }
    public int getMaximumPoolSize() { return maximumPoolSize; }
    public void setMaximumPoolSize(int maximumPoolSize) { this.maximumPoolSize = maximumPoolSize; }
  }

  public static class Planner {
    private int defaultLimit = PlannerConfig.DEFAULT_LIMIT;
    private int maxLimit = PlannerConfig.MAX_LIMIT;
    private int aliasMaxLength = PlannerConfig.ALIAS_MAX_LENGTH;

    /** Fail instead of dropping row-level security predicates that have no join path. */
    private boolean strictRlsBinding;

    public int getDefaultLimit() { return defaultLimit; }
    public void setDefaultLimit(int defaultLimit) { this.defaultLimit = defaultLimit; }
    public int getMaxLimit() { return maxLimit; }
    public void setMaxLimit(int maxLimit) { this.maxLimit = maxLimit; }
    public int getAliasMaxLength() { return aliasMaxLength; }
    public void setAliasMaxLength(int aliasMaxLength) { this.aliasMaxLength = aliasMaxLength; }
    public boolean isStrictRlsBinding() { return strictRlsBinding; }
    public void setStrictRlsBinding(boolean strictRlsBinding) { this.strictRlsBinding = strictRlsBinding; }

    public PlannerConfig toConfig() {
      return new PlannerConfig(defaultLimit, maxLimit, aliasMaxLength, strictRlsBinding);
    }
  }

  public static class Execution {
    /** Statement timeout for executed plans; 0 disables it. */
    private int queryTimeoutSeconds = 30;

    public int getQueryTimeoutSeconds() { return queryTimeoutSeconds; }
    public void setQueryTimeoutSeconds(int queryTimeoutSeconds) { this.queryTimeoutSeconds = queryTimeoutSeconds; }
  }
}
