package org.javai.rollout.sink;

import org.javai.rollout.ComparisonResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Hands records to another sink on an executor, so the caller returns as soon as the
 * record is submitted rather than when a slow or durable write finishes.
 *
 * <p>The executor is owned by the caller; this sink starts no threads of its own.
 * A rejected submission or a failure in the delegate is logged and the record dropped.
 */
public class AsyncResultSink implements ResultSink {

	private static final Logger log = LoggerFactory.getLogger(AsyncResultSink.class);

	private final ResultSink delegate;
	private final Executor executor;

	public AsyncResultSink(ResultSink delegate, Executor executor) {
		this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
		this.executor = Objects.requireNonNull(executor, "executor must not be null");
	}

	@Override
	public void publish(ComparisonResult result) {
		try {
			executor.execute(() -> deliver(result));
		} catch (RejectedExecutionException e) {
			log.warn("Dropped result of experiment [{}]: executor rejected it", result.experimentName());
		}
	}

	private void deliver(ComparisonResult result) {
		try {
			delegate.publish(result);
		} catch (Exception e) {
			log.warn("Asynchronous publication of experiment [{}] failed: {}",
					result.experimentName(), e.getMessage());
		}
	}
}
