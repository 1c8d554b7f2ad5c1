package io.colabel.core.render;

import java.util.logging.Level;
import java.util.logging.Logger;

/// Render listener that forwards events to `java.util.logging`.
///
/// Resolution events are logged at `FINE`, malformed input at `WARNING`.
public class LoggingRenderListener implements RenderListener {

    private static final Logger logger = Logger.getLogger(LoggingRenderListener.class.getName());

    @Override
    public void onBlockResolved(String firstCondition, int branchIndex) {
        logger.fine("Block '" + firstCondition + "' resolved to branch " + branchIndex);
    }

    @Override
    public void onUnterminatedBlock(int offset) {
        logger.warning("Missing endif for block at offset " + offset);
    }

    @Override
    public void onMalformedCondition(String condition) {
        logger.warning("Unsupported condition: " + condition);
    }

    @Override
    public void onConditionError(String condition, RuntimeException error) {
        logger.log(Level.WARNING, "Error evaluating condition: " + condition, error);
    }

    @Override
    public void onPlaceholderResolved(String name, String text) {
        logger.fine("Replacing {{" + name + "}} with \"" + text + "\"");
    }

    @Override
    public void onUnresolvedPlaceholder(String name) {
        logger.fine("No value for {{" + name + "}}");
    }

    @Override
    public void onAuxiliaryCollision(String name, boolean dropped) {
        logger.warning(
                "Auxiliary value '"
                        + name
                        + "' collides with a built-in key"
                        + (dropped ? ", dropped" : ", replacing built-in"));
    }

    @Override
    public void onRenderFailure(String source, RuntimeException error) {
        logger.log(Level.WARNING, "Kept '" + source + "' verbatim after render failure", error);
    }
}
