package ca.gc.cra.beacon.infrastructure.persistence;

import ca.gc.cra.beacon.application.port.Subsystem;
import ca.gc.cra.beacon.config.ServiceConfig.DatabaseSettings;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReference;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Persistence subsystem owning the service's pooled {@link DataSource}.
 * <p><strong>Why:</strong> The database must be reachable before the listener accepts traffic and the pool must be
 * closed before the process exits.</p>
 * <p><strong>Role:</strong> Infrastructure adapter implementing {@link Subsystem}.</p>
 * <p><strong>Thread-safety:</strong> The pool reference is published atomically; {@link #dataSource()} may be called
 * from request threads.</p>
 *
 * @since 0.1.0
 */
public final class HikariPersistence implements Subsystem {
  private static final Logger log = LoggerFactory.getLogger(HikariPersistence.class);
  private static final int VALIDATION_TIMEOUT_SECONDS = 5;

  private final DatabaseSettings settings;
  private final Executor executor;
  private final AtomicReference<HikariDataSource> dataSource = new AtomicReference<>();

  public HikariPersistence(DatabaseSettings settings, Executor executor) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.executor = Objects.requireNonNull(executor, "executor");
  }

  @Override
  public String name() {
    return "persistence";
  }

  /**
   * Opens the pool and validates one connection.
   *
   * @return future completing once a validated connection was obtained
   */
  @Override
  public CompletableFuture<Void> init() {
    return CompletableFuture.runAsync(this::open, executor);
  }

  /**
   * Returns the pooled data source while the subsystem is initialized.
   *
   * @return data source, or empty before {@link #init()} and after {@link #release()}
   */
  public Optional<DataSource> dataSource() {
    return Optional.ofNullable(dataSource.get());
  }

  @Override
  public CompletableFuture<Void> release() {
    HikariDataSource active = dataSource.getAndSet(null);
    if (active == null) {
      return CompletableFuture.completedFuture(null);
    }
    return CompletableFuture.runAsync(() -> {
      if (!active.isClosed()) {
        active.close();
      }
      log.info("Database pool {} closed", settings.poolName());
    }, executor);
  }

  private void open() {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl(settings.url());
    config.setUsername(settings.username());
    config.setPassword(settings.password());
    config.setMaximumPoolSize(settings.maxPoolSize());
    config.setPoolName(settings.poolName());

    HikariDataSource created = new HikariDataSource(config);
    try (Connection connection = created.getConnection()) {
      if (!connection.isValid(VALIDATION_TIMEOUT_SECONDS)) {
        throw new IllegalStateException("Database connection for " + settings.url() + " failed validation");
      }
    } catch (SQLException ex) {
      created.close();
      throw new IllegalStateException("Unable to connect to " + settings.url(), ex);
    } catch (RuntimeException ex) {
      created.close();
      throw ex;
    }
    if (!dataSource.compareAndSet(null, created)) {
      created.close();
      throw new IllegalStateException("persistence already initialized");
    }
    log.info("Database pool {} connected to {}", settings.poolName(), settings.url());
  }
}
