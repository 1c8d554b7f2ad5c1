package io.colabel.cli.commands;

import java.util.concurrent.Callable;

/// Minimal abstract base for all colabel CLI commands.
///
/// Owns the {@link #call()} / {@link #execute()} contract. The value returned by
/// {@link #execute()} becomes the process exit code.
///
/// @see RequestCommand
public abstract class ColabelCommand implements Callable<Integer> {

    protected static final int SUCCESS = 0;
    protected static final int FAILURE = 1;

    @Override
    public final Integer call() {
        return execute();
    }

    protected abstract int execute();
}
