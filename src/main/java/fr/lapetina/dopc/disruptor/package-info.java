/**
 * LMAX Disruptor pipeline forwarding client requests to the balancer's backends.
 *
 * <h2>Pipeline Stages</h2>
 * <pre>
 * Backend Selection → Dispatch (async HTTP) → Completion
 * </pre>
 *
 * <p>Publishing claims a slot with {@code tryNext()}; a full ring buffer raises
 * {@link fr.lapetina.dopc.disruptor.exception.BackpressureException} to the publisher.
 *
 * @see fr.lapetina.dopc.disruptor.ForwardingPipeline
 */
package fr.lapetina.dopc.disruptor;
