/**
 * Standalone server: Javalin routes over the chunk streams server core, a simulated job producer
 * and SmallRye Config based settings.
 */
package io.chunkstreams.runner;
