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

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link Registration} bound to the registry, key and object it was created for. The first {@link #cancel()} wins
 * the cancelled flag and unregisters the object; every other call is a no-op.
 *
 * @author Jon Brisbin
 * @author Stephane Maldini
 */
public class OneShotRegistration<K, V> implements Registration<K, V> {

	private final Registry<K, V> registry;
	private final K              key;
	private final V              object;

	private final AtomicBoolean cancelled = new AtomicBoolean(false);

	public OneShotRegistration(Registry<K, V> registry, K key, V object) {
		this.registry = registry;
		this.key = key;
		this.object = object;
	}

	@Override
	public K getKey() {
		return key;
	}

	@Override
	public V getObject() {
		return object;
	}

	@Override
	public Registration<K, V> cancel() {
		if (cancelled.compareAndSet(false, true)) {
			registry.unregister(key, object);
		}
		return this;
	}

	@Override
	public boolean isCancelled() {
		return cancelled.get();
	}

	@Override
	public String toString() {
		return "OneShotRegistration{" +
		  "\n\tkey=" + key +
		  ",\n\tobject=" + object +
		  ",\n\tcancelled=" + cancelled.get() +
		  "\n}";
	}

}
