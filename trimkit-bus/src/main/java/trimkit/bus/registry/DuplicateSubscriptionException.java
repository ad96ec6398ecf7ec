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

package trimkit.bus.registry;

/**
 * Thrown when an object is registered under a key that already holds an equal object.
 *
 * @author Stephane Maldini
 */
public class DuplicateSubscriptionException extends IllegalStateException {

	private static final long serialVersionUID = -4327650937158123052L;

	private final transient Object key;

	public DuplicateSubscriptionException(Object key) {
		super("Handler is already subscribed for event type " + describe(key) + ".");
		this.key = key;
	}

	/**
	 * @return the key, usually the event type, that already held the handler
	 */
	public Object getKey() {
		return key;
	}

	private static String describe(Object key) {
		return key instanceof Class ? ((Class<?>) key).getName() : String.valueOf(key);
	}
}
