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
 * An {@link Router} that broadcasts an event to every handler, in order, on the calling thread. A handler failure
 * propagates to the publisher and the handlers after it are not invoked.
 *
 * @author Andy Wilkinson
 * @author Stephane Maldini
 */
public class BroadcastRouter implements Router {

	@Override
	@SuppressWarnings("unchecked")
	public <E> void route(@Nullable Object sender, E event, List<? extends EventHandler<?>> handlers) {
		for (EventHandler<?> handler : handlers) {
			((EventHandler<E>) handler).handle(sender, event);
		}
	}

}
