/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: java-callback-util
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

/**
 * Provides a double-ended queue with drain signalling and a single-consumer loop.
 */
package com.ibm.callbackutil.iteration;
