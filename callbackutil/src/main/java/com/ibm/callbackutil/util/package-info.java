/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: java-callback-util
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

/**
 * Continuation types, event loops, and combinators shared by the rest of the library.
 *
 * <p>
 * Every asynchronous operation in this library reports its outcome through a
 * {@link com.ibm.callbackutil.util.Callback}, invoked exactly once.
 */
package com.ibm.callbackutil.util;
