/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: java-callback-util
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

/**
 * Bounded retries for callback-style tasks which hand cooperative lock interruptions back to the
 * caller instead of retrying them.
 */
package com.ibm.callbackutil.retry;
