/**
 * Apache Flink streaming job for Validator Sentinel.
 *
 * <p>
 * Wires the core sweep engine into a Flink pipeline that consumes validator
 * observations from Kafka, sweeps them per vote account against checkpointed
 * keyed state, and publishes sweep records and notifications back to Kafka.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.validatorsentinel.flink.ValidatorSentinelJob}: main entry
 * point</li>
 * <li>{@link com.validatorsentinel.flink.SweepProcessFunction}: keyed process
 * function</li>
 * <li>{@link com.validatorsentinel.flink.JobConfig}: environment-driven
 * configuration</li>
 * <li>{@link com.validatorsentinel.flink.HealthServer}: HTTP health and
 * readiness endpoints</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.validatorsentinel.flink;
