package net.pgtyped.client.jdbc;

import java.sql.SQLException;
import net.pgtyped.client.log.PQLogger;
import net.pgtyped.client.log.PQLoggerFactory;
import net.pgtyped.common.core.ResourceBundleManager;

/**
 * Base class of every failure raised while reading a typed result. The vendor code identifies the
 * {@link ErrorCode}; the SQL state is the error code's default unless the backend supplied one.
 */
public class PgSQLException extends SQLException {
  private static final PQLogger logger = PQLoggerFactory.getLogger(PgSQLException.class);

  private static final long serialVersionUID = 1L;

  static final ResourceBundleManager errorResourceBundleManager =
      ResourceBundleManager.getSingleton(ErrorCode.errorMessageResource);

  private final ErrorCode errorCode;

  /**
   * @param errorCode the error code
   * @param params message parameters
   */
  public PgSQLException(ErrorCode errorCode, Object... params) {
    this(errorCode.getSqlState(), errorCode, params);
  }

  /**
   * Use when the SQL state comes from the backend rather than from the error code.
   *
   * @param sqlState the SQL state to report
   * @param errorCode the error code
   * @param params message parameters
   */
  protected PgSQLException(String sqlState, ErrorCode errorCode, Object... params) {
    super(
        errorResourceBundleManager.getLocalizedMessage(
            String.valueOf(errorCode.getMessageCode()), params),
        sqlState,
        errorCode.getMessageCode());
    this.errorCode = errorCode;

    logger.debug(
        "Result exception: {}, sqlState: {}, vendorCode: {}",
        getMessage(),
        sqlState,
        errorCode.getMessageCode());
  }

  public ErrorCode getPgErrorCode() {
    return errorCode;
  }
}
