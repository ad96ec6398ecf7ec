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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import trimkit.bus.EventHandler;
import trimkit.core.util.Assert;

/**
 * @author Jon Brisbin
 */
public class TraceableDelegatingRouter implements Router {

	private final Router delegate;
	private final Logger log;

	public TraceableDelegatingRouter(Router delegate) {
		Assert.notNull(delegate, "Delegate Router cannot be null.");
		this.delegate = delegate;
		this.log = LoggerFactory.getLogger(delegate.getClass());
	}

	public Router getDelegate() {
		return delegate;
	}

	@Override
	public <E> void route(@Nullable Object sender, E event, List<? extends EventHandler<?>> handlers) {
		if (log.isTraceEnabled()) {
			log.trace("route({}, {}, {})", sender, event, handlers);
		}
		delegate.route(sender, event, handlers);
		if (log.isTraceEnabled()) {
			log.trace("routed {} to {} handler(s)", event, handlers.size());
		}
	}

}
