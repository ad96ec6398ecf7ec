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
 * Callback notified when an event of type {@code T} is published on a {@link Bus}.
 * <p>
 * Handlers are compared with {@link Object#equals(Object)} when detecting duplicate subscriptions. A lambda or a
 * handler object is only ever equal to itself, so two independently created closures are always distinct. To get
 * "same receiver, same method" identity use {@link trimkit.bus.support.EventHandlers#method(Object, String, Class)}.
 *
 * @param <T> the event payload type
 * @author Jon Brisbin
 */
@FunctionalInterface
public interface EventHandler<T> {

	/**
	 * Handle a published event.
	 *
	 * @param sender the publishing component, may be {@code null}
	 * @param event  the event payload, never {@code null}
	 */
	void handle(@Nullable Object sender, T event);

}
