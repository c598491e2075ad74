package com.validatorsentinel.flink;

import com.validatorsentinel.core.config.ThresholdsConfig;
import com.validatorsentinel.core.config.ThresholdsLoader;
import com.validatorsentinel.core.model.Notification;
import com.validatorsentinel.core.model.SweepResult;
import com.validatorsentinel.core.model.ValidatorObservation;
import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.connector.base.DeliveryGuarantee;
import org.apache.flink.connector.kafka.sink.KafkaRecordSerializationSchema;
import org.apache.flink.connector.kafka.sink.KafkaSink;
import org.apache.flink.connector.kafka.source.KafkaSource;
import org.apache.flink.connector.kafka.source.enumerator.initializer.OffsetsInitializer;
import org.apache.flink.streaming.api.CheckpointingMode;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.datastream.SingleOutputStreamOperator;
import org.apache.flink.streaming.api.environment.CheckpointConfig;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Main entry point for the Validator Sentinel Flink job.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   Kafka (observations topic)
 *     -&gt; Deserialize JSON -&gt; ValidatorObservation
 *     -&gt; Key by vote account
 *     -&gt; SweepProcessFunction (delta detection, classification, liveness)
 *     -&gt; SweepResult JSON -&gt; Kafka (records topic)
 *     -&gt; Notification JSON (side output) -&gt; Kafka (alerts topic)
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * Resolved from environment variables via {@link JobConfig}; thresholds come
 * from {@code THRESHOLDS_CONFIG_PATH} or the bundled {@code thresholds.yml}.
 * </p>
 *
 * <h3>Delivery</h3>
 * <p>
 * Checkpointing is exactly-once for keyed state; the sinks are
 * at-least-once. Records and notifications carry a deterministic key, so
 * consumers upsert and a replay after recovery is harmless.
 * </p>
 *
 * @since 1.0.0
 */
public final class ValidatorSentinelJob {

        private static final Logger LOG = LoggerFactory.getLogger(ValidatorSentinelJob.class);

        private ValidatorSentinelJob() {
                // entry-point class, not instantiable
        }

        public static void main(String[] args) throws Exception {
                // 1. Load configuration
                JobConfig config = JobConfig.fromEnvironment();
                LOG.info("Starting Validator Sentinel with config: {}", config);

                // 2. Load thresholds
                ThresholdsConfig thresholds = loadThresholds(config);
                LOG.info("Loaded thresholds: {}", thresholds);

                // 3. Start health server (for K8s liveness and readiness checks) with shutdown hook
                HealthServer healthServer = new HealthServer();
                healthServer.start(config.getHealthPort());
                Runtime.getRuntime().addShutdownHook(new Thread(healthServer::stop, "health-shutdown"));

                // 4. Set up Flink execution environment
                StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
                env.setParallelism(config.getParallelism());
                // records are immutable once emitted
                env.getConfig().enableObjectReuse();
                configureCheckpointing(env, config);

                // 5. Build pipeline
                buildPipeline(env, config, thresholds);
                healthServer.markReady();

                // 6. Execute
                env.execute("Validator Sentinel - Commission and Liveness Monitor");
        }

        // ---------------------------------------------------------------
        // Pipeline assembly
        // ---------------------------------------------------------------

        /**
         * Build the full Kafka -&gt; Flink -&gt; Kafka pipeline.
         */
        static void buildPipeline(StreamExecutionEnvironment env,
                        JobConfig config,
                        ThresholdsConfig thresholds) {
                KafkaSource<ValidatorObservation> kafkaSource = KafkaSource.<ValidatorObservation>builder()
                                .setBootstrapServers(config.getKafkaBootstrapServers())
                                .setTopics(config.getObservationsTopic())
                                .setGroupId(config.getKafkaGroupId())
                                .setProperties(config.kafkaConsumerProperties())
                                .setStartingOffsets(OffsetsInitializer.earliest())
                                .setValueOnlyDeserializer(new ObservationDeserializationSchema())
                                .build();

                // epochs and slots order the sweep, not event time
                DataStream<ValidatorObservation> observations = env.fromSource(
                                kafkaSource,
                                WatermarkStrategy.noWatermarks(),
                                "kafka-observations-source");

                SingleOutputStreamOperator<SweepResult> records = observations
                                .filter(Objects::nonNull) // drop deserialization failures
                                .name("drop-malformed")
                                .keyBy(ValidatorObservation::getEntityId)
                                .process(new SweepProcessFunction(thresholds))
                                .name("validator-sweep")
                                .uid("validator-sweep");

                KafkaSink<SweepResult> recordsSink = KafkaSink.<SweepResult>builder()
                                .setKafkaProducerConfig(config.kafkaProducerProperties())
                                .setBootstrapServers(config.getKafkaBootstrapServers())
                                .setDeliveryGuarantee(DeliveryGuarantee.AT_LEAST_ONCE)
                                .setRecordSerializer(
                                                KafkaRecordSerializationSchema.<SweepResult>builder()
                                                                .setTopic(config.getRecordsTopic())
                                                                .setValueSerializationSchema(
                                                                                new JacksonSerializationSchema<SweepResult>())
                                                                .build())
                                .build();
                records.sinkTo(recordsSink).name("kafka-records-sink");

                KafkaSink<Notification> alertsSink = KafkaSink.<Notification>builder()
                                .setKafkaProducerConfig(config.kafkaProducerProperties())
                                .setBootstrapServers(config.getKafkaBootstrapServers())
                                .setDeliveryGuarantee(DeliveryGuarantee.AT_LEAST_ONCE)
                                .setRecordSerializer(
                                                KafkaRecordSerializationSchema.<Notification>builder()
                                                                .setTopic(config.getAlertsTopic())
                                                                .setValueSerializationSchema(
                                                                                new JacksonSerializationSchema<Notification>())
                                                                .build())
                                .build();
                records.getSideOutput(SweepProcessFunction.NOTIFICATIONS)
                                .sinkTo(alertsSink)
                                .name("kafka-alerts-sink");
        }

        // ---------------------------------------------------------------
        // Helpers
        // ---------------------------------------------------------------

        static ThresholdsConfig loadThresholds(JobConfig config) {
                String path = config.getThresholdsConfigPath();
                if (path != null && !path.isBlank()) {
                        return ThresholdsLoader.fromFile(path);
                }
                return ThresholdsLoader.load();
        }

        private static void configureCheckpointing(StreamExecutionEnvironment env, JobConfig config) {
                long interval = config.getCheckpointIntervalMs();
                env.enableCheckpointing(interval, CheckpointingMode.EXACTLY_ONCE);

                CheckpointConfig cpConfig = env.getCheckpointConfig();
                cpConfig.setMinPauseBetweenCheckpoints(interval / 2);
                cpConfig.setCheckpointTimeout(interval * 2);
                cpConfig.setMaxConcurrentCheckpoints(1);
                // keep the per-validator state restorable after a cancel
                cpConfig.setExternalizedCheckpointCleanup(
                                CheckpointConfig.ExternalizedCheckpointCleanup.RETAIN_ON_CANCELLATION);
        }
}
