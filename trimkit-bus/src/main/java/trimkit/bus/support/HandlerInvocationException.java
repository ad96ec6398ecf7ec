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

package trimkit.bus.support;

import java.lang.reflect.Method;

/**
 * Unchecked wrapper for a checked exception raised by a reflectively invoked handler method, or for a handler
 * method that could not be accessed.
 *
 * @author Jon Brisbin
 */
public class HandlerInvocationException extends RuntimeException {

	private static final long serialVersionUID = 2871541390853367281L;

	public HandlerInvocationException(Method method, Throwable cause) {
		super("Failed to invoke handler method " + method.toGenericString(), cause);
	}

}
