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

import trimkit.bus.registry.Registration;

/**
 * The subscribing side of a {@link Bus}.
 *
 * @author Stephane Maldini
 */
public interface Subscribable {

	/**
	 * Register a {@link EventHandler} to be notified of every event published under {@code type}.
	 *
	 * @param type    The event type to listen to
	 * @param handler The handler to notify
	 * @param <T>     The event type
	 * @return A {@link Registration} that removes the handler when cancelled
	 * @throws trimkit.bus.registry.DuplicateSubscriptionException if an equal handler is already registered for
	 *                                                              {@code type}
	 */
	<T> Registration<Class<?>, EventHandler<?>> subscribe(Class<T> type, EventHandler<? super T> handler);

	/**
	 * Register a {@link EventHandler} to be notified of the next event published under {@code type} only.
	 *
	 * @param type    The event type to listen to
	 * @param handler The handler to notify once
	 * @param <T>     The event type
	 * @return A {@link Registration} that removes the handler when cancelled, if it has not fired yet
	 */
	<T> Registration<Class<?>, EventHandler<?>> subscribeOnce(Class<T> type, EventHandler<? super T> handler);

}
