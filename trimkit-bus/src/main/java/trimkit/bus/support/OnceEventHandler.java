/*
 * Copyright (c) 2011-2016 Pivotal Software Inc, All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package trimkit.bus.support;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import javax.annotation.Nullable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import trimkit.bus.EventHandler;
import trimkit.bus.registry.Registration;
import trimkit.core.util.Assert;

/**
 * {@link EventHandler} that forwards the first event it receives to its delegate and cancels its own
 * {@link Registration} before doing so.
 * <p>
 * Two publishes racing on the same event type may both have selected this handler. Only the one that wins the
 * {@code fired} flag forwards, the other returns without invoking the delegate.
 *
 * @author Stephane Maldini
 */
public final class OnceEventHandler<T> implements EventHandler<T> {

	private static final Logger log = LoggerFactory.getLogger(OnceEventHandler.class);

	private final EventHandler<? super T> delegate;

	private final AtomicBoolean                       fired        = new AtomicBoolean(false);
	private final AtomicReference<Registration<?, ?>> registration = new AtomicReference<>();

	public OnceEventHandler(EventHandler<? super T> delegate) {
		Assert.notNull(delegate, "Handler cannot be null.");
		this.delegate = delegate;
	}

	/**
	 * Attach the {@link Registration} this handler cancels when it fires. If an event already arrived before the
	 * registration was attached, it is cancelled right away.
	 *
	 * @param registration the registration of this handler
	 */
	public void bind(Registration<?, ?> registration) {
		Assert.notNull(registration, "Registration cannot be null.");
		this.registration.set(registration);
		if (fired.get()) {
			registration.cancel();
		}
	}

	/**
	 * @return {@literal true} once an event has been forwarded
	 */
	public boolean hasFired() {
		return fired.get();
	}

	public EventHandler<? super T> getDelegate() {
		return delegate;
	}

	@Override
	public void handle(@Nullable Object sender, T event) {
		if (!fired.compareAndSet(false, true)) {
			return;
		}
		Registration<?, ?> reg = registration.get();
		if (null != reg) {
			reg.cancel();
		}
		if (log.isDebugEnabled()) {
			log.debug("{} fired, registration {}", delegate, (null != reg ? "cancelled" : "not bound yet"));
		}
		delegate.handle(sender, event);
	}

	@Override
	public String toString() {
		return "OnceEventHandler{" +
		  "delegate=" + delegate +
		  ", fired=" + fired.get() +
		  '}';
	}
}
