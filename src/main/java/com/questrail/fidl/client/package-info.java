/**
 * Client-side bindings: request/reply over a channel, and event handling.
 */
package com.questrail.fidl.client;
