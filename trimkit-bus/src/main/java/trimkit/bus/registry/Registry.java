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

import java.util.List;

/**
 * Implementations of this interface manage a registry of objects that are kept in registration order per key.
 *
 * @param <K> the type of key the objects are registered under
 * @param <V> the type of object registered
 * @author Jon Brisbin
 * @author Stephane Maldini
 */
public interface Registry<K, V> extends Iterable<V> {

	/**
	 * Append the given object to the list kept for {@code key}.
	 *
	 * @param key The key to register under.
	 * @param obj The object to assign.
	 * @return a {@link Registration} that can be used to remove {@code obj} later
	 * @throws DuplicateSubscriptionException if an equal object is already registered under {@code key}
	 */
	Registration<K, V> register(K key, V obj);

	/**
	 * Remove the first object equal to {@code obj} registered under {@code key}.
	 *
	 * @param key The key the object was registered under
	 * @param obj The object to remove
	 * @return {@literal true} if an object was removed, {@literal false} otherwise.
	 */
	boolean unregister(K key, V obj);

	/**
	 * Take a snapshot of the objects registered under {@code key}, in registration order. Later changes to the
	 * registry are not reflected in the returned list.
	 *
	 * @param key The key to look up
	 * @return An immutable {@link List} of the objects, empty if nothing is registered for the key
	 */
	List<V> select(K key);

	/**
	 * @param key The key to look up
	 * @return the number of objects currently registered under {@code key}
	 */
	int count(K key);

	/**
	 * @return the number of keys having at least one registered object
	 */
	int size();

	/**
	 * Clear the {@link Registry}, resetting its state. Cancelling a {@link Registration} made before the clear is a
	 * no-op afterwards, unless an equal object has been registered under the same key since, in which case that
	 * object is unregistered.
	 */
	void clear();

}
