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

package trimkit.bus;

import java.util.List;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import trimkit.bus.registry.Registration;
import trimkit.bus.registry.Registries;
import trimkit.bus.registry.Registry;
import trimkit.bus.routing.BroadcastRouter;
import trimkit.bus.routing.Router;
import trimkit.bus.spec.EventBusSpec;
import trimkit.bus.support.OnceEventHandler;
import trimkit.core.util.Assert;

/**
 * An event bus is an in-process gateway that allows components to subscribe {@link EventHandler EventHandlers} to an
 * event type and be notified of the events other components publish, without holding references to each other.
 * </p>
 * Events are keyed by their {@link Class}. Handlers for a type are kept in subscription order and a publish notifies
 * a snapshot of them, taken when the publish starts, synchronously on the publishing thread. No lock is held while a
 * handler runs, so handlers can subscribe, unsubscribe, cancel registrations or publish again, including events of
 * the type being handled. A handler subscribed during a publish is not notified by that publish but is by every
 * publish starting after its subscription returned.
 * </p>
 * An exception thrown by a handler propagates to the publisher; the handlers after it in the snapshot are skipped.
 *
 * @author Jon Brisbin
 * @author Stephane Maldini
 * @author Andy Wilkinson
 */
public class EventBus implements Bus {

	private static final Logger log = LoggerFactory.getLogger(EventBus.class);

	private static final String DEFAULT_NAME = "eventBus";

	private final String                              name;
	private final Registry<Class<?>, EventHandler<?>> handlerRegistry;
	private final Router                              router;

	/**
	 * Create a new {@link EventBusSpec} to configure an EventBus.
	 *
	 * @return The EventBus spec
	 */
	public static EventBusSpec config() {
		return new EventBusSpec();
	}

	/**
	 * Create a new {@link EventBus} with a default registry and router.
	 *
	 * @return A new {@link EventBus}
	 */
	public static EventBus create() {
		return new EventBus();
	}

	/**
	 * The process-wide {@link EventBus}, created on first access. It has the same thread-safety contract as any other
	 * instance.
	 *
	 * @return the shared {@link EventBus}
	 */
	public static EventBus instance() {
		return SharedInstance.INSTANCE;
	}

	public EventBus() {
		this(DEFAULT_NAME, null, null);
	}

	/**
	 * Create a new {@literal EventBus}.
	 *
	 * @param name            The name of this bus, used in log output
	 * @param handlerRegistry The {@link Registry} holding the subscriptions. May be {@code null} in which case a new
	 *                        one is created. A registry may be shared by several buses.
	 * @param router          The {@link Router} invoking the handlers of a publish. May be {@code null} in which case
	 *                        a {@link BroadcastRouter} is used.
	 */
	public EventBus(@Nonnull String name,
	                @Nullable Registry<Class<?>, EventHandler<?>> handlerRegistry,
	                @Nullable Router router) {
		Assert.notNull(name, "Name cannot be null.");
		this.name = name;
		this.handlerRegistry = (null == handlerRegistry ? Registries.<Class<?>, EventHandler<?>>create() : handlerRegistry);
		this.router = (null == router ? new BroadcastRouter() : router);
	}

	public String getName() {
		return name;
	}

	/**
	 * Get the {@link Registry} in use to maintain the handlers currently subscribed on this bus.
	 *
	 * @return The {@link Registry} in use.
	 */
	public Registry<Class<?>, EventHandler<?>> getHandlerRegistry() {
		return handlerRegistry;
	}

	/**
	 * Get the {@link Router} used to invoke handlers.
	 *
	 * @return The {@link Router}.
	 */
	public Router getRouter() {
		return router;
	}

	@Override
	public <T> Registration<Class<?>, EventHandler<?>> subscribe(Class<T> type, EventHandler<? super T> handler) {
		Assert.notNull(type, "Event type cannot be null.");
		Assert.notNull(handler, "Handler cannot be null.");

		Registration<Class<?>, EventHandler<?>> reg = handlerRegistry.register(type, handler);
		if (log.isDebugEnabled()) {
			log.debug("{}: subscribed {} to {}", name, handler, type.getName());
		}
		return reg;
	}

	@Override
	public <T> Registration<Class<?>, EventHandler<?>> subscribeOnce(Class<T> type, EventHandler<? super T> handler) {
		Assert.notNull(type, "Event type cannot be null.");
		Assert.notNull(handler, "Handler cannot be null.");

		OnceEventHandler<T> once = new OnceEventHandler<>(handler);
		Registration<Class<?>, EventHandler<?>> reg = subscribe(type, once);
		once.bind(reg);
		return reg;
	}

	@Override
	public <T> boolean unsubscribe(Class<T> type, EventHandler<? super T> handler) {
		Assert.notNull(type, "Event type cannot be null.");
		Assert.notNull(handler, "Handler cannot be null.");

		boolean removed = handlerRegistry.unregister(type, handler);
		if (removed && log.isDebugEnabled()) {
			log.debug("{}: unsubscribed {} from {}", name, handler, type.getName());
		}
		return removed;
	}

	@Override
	public <T> void publish(@Nullable Object sender, T event) {
		Assert.notNull(event, "Event cannot be null.");
		route(event.getClass(), sender, event);
	}

	@Override
	public <T> void publish(T event) {
		publish(null, event);
	}

	@Override
	public <T> void publish(Class<T> type, @Nullable Object sender, T event) {
		Assert.notNull(type, "Event type cannot be null.");
		Assert.notNull(event, "Event cannot be null.");
		Assert.isTrue(type.isInstance(event), "Event is not an instance of " + type.getName() + ".");
		route(type, sender, event);
	}

	@Override
	public int getSubscriberCount(Class<?> type) {
		Assert.notNull(type, "Event type cannot be null.");
		return handlerRegistry.count(type);
	}

	@Override
	public boolean respondsTo(Class<?> type) {
		return getSubscriberCount(type) > 0;
	}

	@Override
	public void reset() {
		handlerRegistry.clear();
		log.debug("{}: reset, all subscriptions removed", name);
	}

	@Override
	public String toString() {
		return "EventBus{" +
		  "name='" + name + '\'' +
		  ", eventTypes=" + handlerRegistry.size() +
		  '}';
	}

	protected void route(Class<?> type, @Nullable Object sender, Object event) {
		List<EventHandler<?>> handlers = handlerRegistry.select(type);
		if (handlers.isEmpty()) {
			return;
		}
		router.route(sender, event, handlers);
	}

	private static final class SharedInstance {
		static final EventBus INSTANCE = new EventBus();
	}

}
