/**
 * Blocking SPI the chat engine is written against: durable store, shared cache, distribution bus and rate
 * limiting.
 */
package io.chatbox.server.spi;
