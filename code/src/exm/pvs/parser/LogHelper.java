package exm.pvs.parser;

import org.apache.log4j.Level;
import org.apache.log4j.Logger;

import exm.pvs.ast.SourcePosition;
import exm.pvs.common.Logging;

/**
 * Helper functions to augment log messages with contextual information about
 * the current position and nesting depth.
 */
class LogHelper {
  static final Logger logger = Logging.getPvsLogger();

  /**
     TRACE-level with indentation for nice output
   */
  static void trace(int indent, SourcePosition pos, String msg) {
    if (logger.isTraceEnabled()) {
      log(indent, Level.TRACE, pos, msg);
    }
  }

  /**
     DEBUG-level with location prefix
   */
  static void debug(SourcePosition pos, String msg) {
    if (logger.isDebugEnabled()) {
      log(0, Level.DEBUG, pos, msg);
    }
  }

  static void log(int indent, Level level, SourcePosition pos, String msg) {
    StringBuilder sb = new StringBuilder(256);
    if (pos != null) {
      sb.append(pos).append(": ");
    }
    for (int i = 0; i < indent; i++)
      sb.append(' ');
    sb.append(msg);
    logger.log(level, sb.toString());
  }
}
