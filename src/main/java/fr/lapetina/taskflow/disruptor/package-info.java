/**
 * LMAX Disruptor request pipeline.
 *
 * <p>Every HTTP request is published into a pre-allocated ring buffer and passes
 * the gate stages in order:
 * <pre>
 * Routing → Block Check → Rate Limit → Dispatch → Completion
 * </pre>
 *
 * <p>The block check runs before the fixed-window stage so that a client inside
 * a progressive block never consumes a rate-limit slot. Rejections are rendered
 * by the dispatch stage; route handlers run asynchronously and complete the
 * caller's future from their own thread.
 *
 * @see fr.lapetina.taskflow.disruptor.DisruptorPipeline
 * @see com.lmax.disruptor.dsl.Disruptor
 */
package fr.lapetina.taskflow.disruptor;
