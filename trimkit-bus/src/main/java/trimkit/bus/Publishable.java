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

import javax.annotation.Nullable;

/**
 * The publishing side of a {@link Bus}.
 *
 * @author Stephane Maldini
 */
public interface Publishable {

	/**
	 * Publish an event to the handlers subscribed to its runtime class. Handlers run synchronously on the calling
	 * thread, in subscription order.
	 *
	 * @param sender The publishing component, may be {@code null}
	 * @param event  The event
	 * @param <T>    The event type
	 */
	<T> void publish(@Nullable Object sender, T event);

	/**
	 * Publish an event without a sender.
	 *
	 * @param event The event
	 * @param <T>   The event type
	 */
	<T> void publish(T event);

	/**
	 * Publish an event to the handlers subscribed to {@code type}, which may be a supertype or an interface of the
	 * event's runtime class.
	 *
	 * @param type   The event type to publish under
	 * @param sender The publishing component, may be {@code null}
	 * @param event  The event, an instance of {@code type}
	 * @param <T>    The event type
	 */
	<T> void publish(Class<T> type, @Nullable Object sender, T event);

}
