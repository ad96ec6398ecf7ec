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

package trimkit.bus.routing;

import java.util.List;
import javax.annotation.Nullable;

import trimkit.bus.EventHandler;

/**
 * An {@code Router} is used to route an event to its handlers.
 *
 * @author Andy Wilkinson
 * @author Stephane Maldini
 */
public interface Router {

	/**
	 * Routes the {@code event}, sent by {@code sender}, to the {@code handlers}. The handlers are a snapshot taken
	 * when the event was published and every one of them accepts the event's type.
	 *
	 * @param sender   The component that published the event, may be {@code null}
	 * @param event    The event to route
	 * @param handlers The handlers to route the event to, in registration order
	 * @param <E>      The type of the event
	 */
	<E> void route(@Nullable Object sender, E event, List<? extends EventHandler<?>> handlers);

}
