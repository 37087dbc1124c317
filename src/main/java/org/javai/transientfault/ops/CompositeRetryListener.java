package org.javai.transientfault.ops;

import org.javai.transientfault.retry.RetryListener;
import org.javai.transientfault.retry.RetryingEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.function.Consumer;

/**
 * An immutable set of {@link RetryListener}s notified together.
 *
 * <p>Every listener receives every event, in registration order. A listener that throws is
 * logged and skipped; the remaining listeners are still notified and the exception never
 * reaches the retry loop. {@link org.javai.transientfault.retry.RetryPolicy} keeps its
 * subscribers in one of these and delivers each event through it, adding the listener of
 * the current call with {@link #with(RetryListener)}.
 *
 * <p>Example usage:
 * <pre>{@code
 * RetryListener listener = CompositeRetryListener.of(
 *     new Log4jRetryListener("orders.fetch"),
 *     new MetricsRetryListener("orders", "fetch")
 * );
 * }</pre>
 */
public final class CompositeRetryListener implements RetryListener {

	private static final Logger log = LoggerFactory.getLogger(CompositeRetryListener.class);

	private static final CompositeRetryListener EMPTY = new CompositeRetryListener(List.of());

	private final List<RetryListener> listeners;

	private CompositeRetryListener(List<RetryListener> listeners) {
		this.listeners = List.copyOf(listeners);
	}

	/**
	 * Returns a composite without listeners.
	 */
	public static CompositeRetryListener empty() {
		return EMPTY;
	}

	/**
	 * Creates a composite of the given listeners. Nulls are skipped and nested composites are flattened.
	 */
	public static CompositeRetryListener of(RetryListener... listeners) {
		return of(Arrays.asList(listeners));
	}

	/**
	 * Creates a composite of the given listeners. Nulls are skipped and nested composites are flattened.
	 */
	public static CompositeRetryListener of(Collection<? extends RetryListener> listeners) {
		List<RetryListener> flat = new ArrayList<>();
		for (RetryListener listener : listeners) {
			if (listener instanceof CompositeRetryListener composite) {
				flat.addAll(composite.listeners);
			} else if (listener != null) {
				flat.add(listener);
			}
		}
		return flat.isEmpty() ? EMPTY : new CompositeRetryListener(flat);
	}

	/**
	 * Returns a composite that also notifies the given listener, last. The listener is kept
	 * as given, so {@link #without(RetryListener)} can remove it again even if it is a composite.
	 * Returns this composite when the listener is null.
	 */
	public CompositeRetryListener with(RetryListener listener) {
		if (listener == null) {
			return this;
		}
		List<RetryListener> extended = new ArrayList<>(listeners);
		extended.add(listener);
		return new CompositeRetryListener(extended);
	}

	/**
	 * Returns a composite without the first listener equal to the given one,
	 * or this composite when there is none.
	 */
	public CompositeRetryListener without(RetryListener listener) {
		List<RetryListener> reduced = new ArrayList<>(listeners);
		if (!reduced.remove(listener)) {
			return this;
		}
		return reduced.isEmpty() ? EMPTY : new CompositeRetryListener(reduced);
	}

	public List<RetryListener> listeners() {
		return listeners;
	}

	public boolean isEmpty() {
		return listeners.isEmpty();
	}

	@Override
	public void onRetrying(RetryingEvent event) {
		deliver("onRetrying", listener -> listener.onRetrying(event));
	}

	@Override
	public void onRetryExhausted(Throwable lastError, int totalAttempts) {
		deliver("onRetryExhausted", listener -> listener.onRetryExhausted(lastError, totalAttempts));
	}

	private void deliver(String method, Consumer<RetryListener> notification) {
		for (RetryListener listener : listeners) {
			try {
				notification.accept(listener);
			} catch (RuntimeException e) {
				log.warn("RetryListener.{} failed for {}", method, listener.getClass().getName(), e);
			}
		}
	}

	@Override
	public String toString() {
		return "CompositeRetryListener" + listeners;
	}
}
