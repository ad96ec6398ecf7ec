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

/**
 * The unsubscribing side of a {@link Bus}.
 *
 * @author Stephane Maldini
 */
public interface Unsubscribable {

	/**
	 * Remove a previously subscribed {@link EventHandler}. Removing a handler that is not subscribed is not an error.
	 *
	 * @param type    The event type the handler was subscribed to
	 * @param handler The handler to remove
	 * @param <T>     The event type
	 * @return {@literal true} if the handler was removed, {@literal false} if it was not subscribed
	 */
	<T> boolean unsubscribe(Class<T> type, EventHandler<? super T> handler);

}
