/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: java-callback-util
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

/**
 * Provides a callback-style mutual exclusion lock with cooperative cancellation. Waiters are
 * queued instead of blocked, and woken on a later tick of an
 * {@link com.ibm.callbackutil.util.EventLoop}.
 */
package com.ibm.callbackutil.locks;
