package io.github.hotbrkm.mailgoat.dispatcher.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.hotbrkm.mailgoat.dispatcher.config.MailgoatConfig;
import io.github.hotbrkm.mailgoat.dispatcher.profile.JsonFileProfileStore;
import io.github.hotbrkm.mailgoat.dispatcher.profile.MailProfile;
import io.github.hotbrkm.mailgoat.dispatcher.send.engine.BatchDispatcher;
import io.github.hotbrkm.mailgoat.dispatcher.send.engine.BatchSendService;
import io.github.hotbrkm.mailgoat.dispatcher.send.engine.BatchSummaryAggregator;
import io.github.hotbrkm.mailgoat.dispatcher.send.engine.metrics.BatchSendMetrics;
import io.github.hotbrkm.mailgoat.dispatcher.send.entry.RecipientSourceReader;
import io.github.hotbrkm.mailgoat.dispatcher.send.result.BatchStorageException;
import io.github.hotbrkm.mailgoat.dispatcher.send.result.BatchStore;
import io.github.hotbrkm.mailgoat.dispatcher.send.result.JsonFileBatchStore;
import io.github.hotbrkm.mailgoat.dispatcher.send.template.TemplateLoader;
import io.github.hotbrkm.mailgoat.dispatcher.send.template.TemplateRenderer;
import io.github.hotbrkm.mailgoat.dispatcher.send.transport.MailApiClient;
import io.github.hotbrkm.mailgoat.dispatcher.send.transport.MailApiClientFactory;
import io.github.hotbrkm.mailgoat.dispatcher.send.transport.MailApiNetworkException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.mock.env.MockEnvironment;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@DisplayName("MailgoatCommandRunner command line behaviour")
class MailgoatCommandRunnerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @TempDir
    Path tempDir;

    private MockEnvironment environment;
    private JsonFileProfileStore profileStore;
    private BatchStore batchStore;
    private MailApiClient client;
    private MailApiClientFactory clientFactory;
    private MailgoatCommandRunner runner;

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;
    private String stdin = "";

    @BeforeEach
    void setUp() {
        environment = new MockEnvironment();
        profileStore = new JsonFileProfileStore(tempDir.resolve("profiles.json"), objectMapper);
        batchStore = new JsonFileBatchStore(tempDir.resolve("batches"), objectMapper);
        client = mock(MailApiClient.class);
        clientFactory = mock(MailApiClientFactory.class);
        when(clientFactory.create(any())).thenReturn(client);
        runner = newRunner(batchStore);
    }

    private MailgoatCommandRunner newRunner(BatchStore store) {
        MailgoatConfig config = new MailgoatConfig();
        config.setProgressEnabled(false);
        CliJsonWriter jsonWriter = new CliJsonWriter(objectMapper);
        BatchSummaryAggregator aggregator = new BatchSummaryAggregator();
        BatchSendService sendService = new BatchSendService(
                new RecipientSourceReader(objectMapper),
                new TemplateLoader(objectMapper),
                new BatchDispatcher(new TemplateRenderer(), new BatchSendMetrics(new SimpleMeterRegistry())),
                clientFactory, store, aggregator);
        return new MailgoatCommandRunner(List.of(
                new SendBatchCommand(profileStore, sendService, jsonWriter, config, environment),
                new BatchStatusCommand(store, aggregator, jsonWriter),
                new ProfileCommand(profileStore, jsonWriter)));
    }

    private int run(String... args) {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        CommandIo io = new CommandIo(new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)),
                new PrintStream(out, true, StandardCharsets.UTF_8), new PrintStream(err, true, StandardCharsets.UTF_8));
        return runner.execute(args, io);
    }

    private JsonNode stdoutJson() throws Exception {
        return objectMapper.readTree(out.toString(StandardCharsets.UTF_8));
    }

    private Path write(String name, String content) throws Exception {
        return Files.writeString(tempDir.resolve(name), content);
    }

    private void addWorkProfile() {
        profileStore.add(MailProfile.builder().name("work").server("https://postal.example.com")
                .apiKey("secret-key-9876").fromAddress("noreply@example.com").build(), false);
    }

    @Test
    @DisplayName("No arguments prints usage; unknown commands are usage errors")
    void usage() {
        assertThat(run()).isEqualTo(ExitCodes.OK);
        assertThat(out.toString(StandardCharsets.UTF_8)).contains("send-batch", "batch status", "profile list");

        assertThat(run("frobnicate")).isEqualTo(ExitCodes.INVALID_INPUT);
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("unknown command: frobnicate");
    }

    @Nested
    @DisplayName("profile")
    class Profiles {

        @Test
        @DisplayName("add, list and use manage the stored default with masked keys")
        void addListUse() throws Exception {
            assertThat(run("profile", "add", "work", "--server", "https://postal.example.com",
                    "--api-key", "secret-key-9876", "--from-address", "noreply@example.com")).isEqualTo(ExitCodes.OK);
            assertThat(stdoutJson().get("default").asBoolean()).isTrue();
            assertThat(stdoutJson().get("api_key").asText()).isEqualTo("****9876");

            assertThat(run("profile", "add", "home", "--server=https://mail.example.org", "--api-key=k2")).isEqualTo(ExitCodes.OK);
            assertThat(run("profile", "use", "home")).isEqualTo(ExitCodes.OK);
            assertThat(stdoutJson().get("default_profile").asText()).isEqualTo("home");

            assertThat(run("profile", "list")).isEqualTo(ExitCodes.OK);
            JsonNode list = stdoutJson();
            assertThat(list).hasSize(2);
            assertThat(list.get(0).get("name").asText()).isEqualTo("home");
            assertThat(list.get(0).get("default").asBoolean()).isTrue();
            assertThat(out.toString(StandardCharsets.UTF_8)).doesNotContain("secret-key-9876");
        }

        @Test
        @DisplayName("Missing required options and unknown names are reported")
        void errors() {
            assertThat(run("profile", "add", "work", "--server", "https://x.example.com")).isEqualTo(ExitCodes.INVALID_INPUT);
            assertThat(err.toString(StandardCharsets.UTF_8)).contains("--api-key is required");
            assertThat(run("profile", "use", "ghost")).isEqualTo(ExitCodes.FAILURE);
        }
    }

    @Nested
    @DisplayName("send-batch")
    class SendBatch {

        @Test
        @DisplayName("Sends every row, prints the summary and stores a queryable batch")
        void sendsAndQueries() throws Exception {
            addWorkProfile();
            when(client.send(anyList(), anyString(), anyString(), any(), anyList())).thenReturn("m-1", "m-2");
            Path csv = write("r.csv", "to,subject,body\nuser1@example.com,Welcome,Hello user1\nuser2@example.com,Welcome,Hello user2\n");

            assertThat(run("send-batch", "--csv", csv.toString())).isEqualTo(ExitCodes.OK);
            JsonNode summary = stdoutJson();
            assertThat(summary.get("status").asText()).isEqualTo("completed");
            assertThat(summary.get("sent").asInt()).isEqualTo(2);
            verify(client).send(eq(List.of("user1@example.com")), eq("Welcome"), eq("Hello user1"),
                    eq("noreply@example.com"), eq(List.of()));

            String batchId = summary.get("batch_id").asText();
            assertThat(run("batch", "status", batchId)).isEqualTo(ExitCodes.OK);
            assertThat(stdoutJson().get("batch_id").asText()).isEqualTo(batchId);
            assertThat(stdoutJson().get("total").asInt()).isEqualTo(2);
        }

        @Test
        @DisplayName("Stdin rows with a template, using the environment profile")
        void stdinWithTemplate() throws Exception {
            addWorkProfile();
            profileStore.add(MailProfile.builder().name("other").server("https://o.example.com").apiKey("k").build(), true);
            environment.setProperty("MAILGOAT_PROFILE", "work");
            when(client.send(anyList(), anyString(), anyString(), any(), anyList())).thenReturn("m-1");
            Path template = write("t.json", "{\"subject\":\"Hi {{name}}\",\"body\":\"Code {{code}}\"}");
            stdin = "[{\"to\":\"a@example.com\",\"name\":\"Ada\",\"code\":7}]";

            assertThat(run("send-batch", "--stdin", "--template", template.toString())).isEqualTo(ExitCodes.OK);
            assertThat(stdoutJson().get("profile").asText()).isEqualTo("work");
            verify(client).send(List.of("a@example.com"), "Hi Ada", "Code 7", "noreply@example.com", List.of());
        }

        @Test
        @DisplayName("A failing row aborts the batch with exit code 1")
        void aborts() throws Exception {
            addWorkProfile();
            when(client.send(anyList(), anyString(), anyString(), any(), anyList()))
                    .thenReturn("m-1")
                    .thenThrow(new MailApiNetworkException("timeout", null));
            Path csv = write("r.csv", "to,subject,body\na@example.com,s,b\nb@example.com,s,b\nc@example.com,s,b\n");

            assertThat(run("send-batch", "--csv", csv.toString())).isEqualTo(ExitCodes.FAILURE);
            JsonNode summary = stdoutJson();
            assertThat(summary.get("status").asText()).isEqualTo("aborted");
            assertThat(summary.get("attempted").asInt()).isEqualTo(2);
            assertThat(summary.get("aborted_at_row").asInt()).isEqualTo(1);
            assertThat(err.toString(StandardCharsets.UTF_8)).contains("aborted at row 1: timeout");
        }

        @Test
        @DisplayName("With continue-on-error a partial failure still exits 0")
        void continuesOnError() throws Exception {
            addWorkProfile();
            when(client.send(anyList(), anyString(), anyString(), any(), anyList()))
                    .thenThrow(new MailApiNetworkException("timeout", null))
                    .thenReturn("m-2");
            Path csv = write("r.csv", "to,subject,body\na@example.com,s,b\nb@example.com,s,b\n");

            assertThat(run("send-batch", "--csv", csv.toString(), "--continue-on-error")).isEqualTo(ExitCodes.OK);
            assertThat(stdoutJson().get("status").asText()).isEqualTo("partially_failed");
        }

        @Test
        @DisplayName("Input and configuration problems exit 2 before any send")
        void invalidInput() throws Exception {
            Path csv = write("r.csv", "to,subject,body\na@example.com,s,b\n");

            assertThat(run("send-batch", "--csv", csv.toString())).isEqualTo(ExitCodes.INVALID_INPUT);
            assertThat(err.toString(StandardCharsets.UTF_8)).contains("profile");

            addWorkProfile();
            assertThat(run("send-batch")).isEqualTo(ExitCodes.INVALID_INPUT);
            assertThat(run("send-batch", "--csv", csv.toString(), "--stdin")).isEqualTo(ExitCodes.INVALID_INPUT);
            assertThat(run("send-batch", "--csv", csv.toString(), "--rate-limit", "0.5")).isEqualTo(ExitCodes.INVALID_INPUT);
            assertThat(run("send-batch", "--csv", tempDir.resolve("missing.csv").toString())).isEqualTo(ExitCodes.INVALID_INPUT);
            assertThat(run("send-batch", "--csv", csv.toString(), "--profile", "ghost")).isEqualTo(ExitCodes.FAILURE);
            assertThat(run("send-batch", "--csv")).isEqualTo(ExitCodes.INVALID_INPUT);
            verifyNoInteractions(client);
        }

        @Test
        @DisplayName("A storage failure exits 3 and still prints the summary")
        void storageFailure() throws Exception {
            addWorkProfile();
            BatchStore failing = mock(BatchStore.class);
            doThrow(new BatchStorageException("disk full")).when(failing).save(any());
            runner = newRunner(failing);
            when(client.send(anyList(), anyString(), anyString(), any(), anyList())).thenReturn("m-1");
            Path csv = write("r.csv", "to,subject,body\na@example.com,s,b\n");

            assertThat(run("send-batch", "--csv", csv.toString())).isEqualTo(ExitCodes.STORAGE_ERROR);
            JsonNode summary = stdoutJson();
            assertThat(summary.get("persisted").asBoolean()).isFalse();
            assertThat(summary.get("storage_error").asText()).isEqualTo("disk full");
        }
    }

    @Test
    @DisplayName("batch status of an unknown id prints a not-found document and exits 1")
    void batchNotFound() throws Exception {
        assertThat(run("batch", "status", "nope")).isEqualTo(ExitCodes.FAILURE);
        JsonNode json = stdoutJson();
        assertThat(json.get("error").asText()).isEqualTo("batch not found");
        assertThat(json.get("batch_id").asText()).isEqualTo("nope");

        assertThat(run("batch", "delete", "x")).isEqualTo(ExitCodes.INVALID_INPUT);
    }
}
