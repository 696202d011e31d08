package me.synapsed.alerts.compiler;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import me.synapsed.alerts.config.AlertsConfig;
import me.synapsed.alerts.config.ConfigLoader;
import me.synapsed.alerts.document.TemplateResourceDocument;
import me.synapsed.alerts.errors.AlertsConfigurationException;
import me.synapsed.alerts.errors.InvalidTopicReferenceException;
import me.synapsed.alerts.model.Resource;
import me.synapsed.alerts.model.ResourceTypes;
import me.synapsed.alerts.model.Severity;

public class TopicSynthesizerTest {
    private TopicSynthesizer synthesizer;
    private TemplateResourceDocument document;

    @BeforeEach
    void setUp() {
        synthesizer = new TopicSynthesizer();
        document = new TemplateResourceDocument();
    }

    @Test
    public void testTopicNameCreatesTopic() {
        AlertsConfig config = config(
            "topics:",
            "  alarm: my-topic-name");

        ActionTopicTable table = synthesizer.compileAlertTopics(config.getTopics(), document);

        assertEquals(Map.of("Ref", "AwsAlertsAlarm"), table.defaultTarget(Severity.ALARM).get());
        assertFalse(table.defaultTarget(Severity.OK).isPresent());

        Resource topic = document.get("AwsAlertsAlarm").get();
        assertEquals(ResourceTypes.TOPIC, topic.getType());
        assertEquals("my-topic-name", topic.getProperties().get("TopicName"));
        assertEquals(List.of(), topic.getProperties().get("Subscription"));
    }

    @Test
    public void testExistingTopicsAreReferencedAsIs() {
        AlertsConfig config = config(
            "topics:",
            "  ok: arn:aws:sns:us-east-1:123456789012:ok-topic",
            "  alarm:",
            "    topic:",
            "      Ref: SharedAlarmTopic");

        ActionTopicTable table = synthesizer.compileAlertTopics(config.getTopics(), document);

        assertEquals("arn:aws:sns:us-east-1:123456789012:ok-topic", table.defaultTarget(Severity.OK).get());
        assertEquals(Map.of("Ref", "SharedAlarmTopic"), table.defaultTarget(Severity.ALARM).get());
        assertTrue(document.resources().isEmpty());
    }

    @Test
    public void testNotificationsBecomeSubscriptions() {
        AlertsConfig config = config(
            "topics:",
            "  insufficientData:",
            "    topic: data-topic",
            "    notifications:",
            "      - protocol: email",
            "        endpoint: ops@example.com");

        synthesizer.compileAlertTopics(config.getTopics(), document);

        Resource topic = document.get("AwsAlertsInsufficientData").get();
        assertEquals(List.of(Map.of("Protocol", "email", "Endpoint", "ops@example.com")),
            topic.getProperties().get("Subscription"));
    }

    @Test
    public void testGroupedTopics() {
        AlertsConfig config = config(
            "topics:",
            "  alarm: default-alarms",
            "  critical:",
            "    alarm: critical-alarms",
            "    ok: arn:aws:sns:us-east-1:123456789012:critical-ok");

        ActionTopicTable table = synthesizer.compileAlertTopics(config.getTopics(), document);

        assertEquals(Map.of("Ref", "AwsAlertsCriticalAlarm"), table.groupTarget("critical", Severity.ALARM, "a"));
        assertEquals("arn:aws:sns:us-east-1:123456789012:critical-ok",
            table.groupTarget("critical", Severity.OK, "a"));
        assertEquals("critical-alarms", document.get("AwsAlertsCriticalAlarm").get().getProperties().get("TopicName"));
        assertEquals(2, document.resources().size());

        InvalidTopicReferenceException exception = assertThrows(InvalidTopicReferenceException.class,
            () -> table.groupTarget("critical", Severity.INSUFFICIENT_DATA, "highErrors"));
        assertEquals("highErrors", exception.getAlarmName());
        assertThrows(InvalidTopicReferenceException.class,
            () -> table.groupTarget("unknown", Severity.ALARM, "highErrors"));
    }

    @Test
    public void testMissingTopicsYieldEmptyTable() {
        ActionTopicTable table = synthesizer.compileAlertTopics(null, document);

        assertTrue(table.isEmpty());
        assertTrue(document.resources().isEmpty());
    }

    @Test
    public void testUnknownSeverityInGroupIsRejected() {
        assertThrows(AlertsConfigurationException.class, () -> config(
            "topics:",
            "  critical:",
            "    page: pager-topic"));
    }

    private static AlertsConfig config(String... lines) {
        return ConfigLoader.parseAlertsConfig(String.join("\n", lines));
    }
}
