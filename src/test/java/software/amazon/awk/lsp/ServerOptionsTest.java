package software.amazon.awk.lsp;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import java.io.File;
import java.util.List;
import java.util.Map;
import org.eclipse.lsp4j.MessageType;
import org.junit.jupiter.api.Test;

public class ServerOptionsTest {
    private final StubClient stubClient = new StubClient();
    private final AwkLanguageClient client = new AwkLanguageClient(stubClient);

    @Test
    public void defaults() {
        ServerOptions options = ServerOptions.defaults();

        assertThat(options.getMaxNumberOfProblems(), equalTo(100));
        assertThat(options.getExtendedMode(), is(true));
        assertThat(options.getMissingSemicolonWarnings(), is(false));
        assertThat(options.getCompatibilityWarnings(), is(true));
        assertThat(options.getFunctionCallArityChecks(), is(true));
    }

    @Test
    public void readsSettingsSection() {
        JsonObject settings = JsonParser.parseString("""
                {
                    "awk": {
                        "maxNumberOfProblems": 5,
                        "mode": "awk",
                        "stylisticWarnings": {
                            "missingSemicolon": true,
                            "compatibility": false,
                            "functionCallArity": false
                        },
                        "path": ["/usr/share/awk", "lib"]
                    }
                }
                """).getAsJsonObject();

        ServerOptions options = ServerOptions.fromSettings(settings, client);

        assertThat(options.getMaxNumberOfProblems(), equalTo(5));
        assertThat(options.getExtendedMode(), is(false));
        assertThat(options.getMissingSemicolonWarnings(), is(true));
        assertThat(options.getCompatibilityWarnings(), is(false));
        assertThat(options.getFunctionCallArityChecks(), is(false));
        assertThat(options.getIncludePath(), contains("/usr/share/awk", "lib"));
        assertThat(stubClient.logged, empty());
    }

    @Test
    public void readsUnwrappedSettings() {
        JsonObject settings = new JsonObject();
        settings.addProperty("mode", "gawk");
        settings.addProperty("path", "/a" + File.pathSeparator + File.pathSeparator + "/b");

        ServerOptions options = ServerOptions.fromSettings(settings, client);

        assertThat(options.getExtendedMode(), is(true));
        assertThat(options.getIncludePath(), contains("/a", ".", "/b"));
    }

    @Test
    public void reportsInvalidSettings() {
        JsonObject settings = new JsonObject();
        settings.addProperty("maxNumberOfProblems", -1);
        settings.addProperty("mode", "nawk");
        settings.add("path", new JsonObject());

        ServerOptions options = ServerOptions.fromSettings(settings, client);

        assertThat(options.getMaxNumberOfProblems(), equalTo(100));
        assertThat(options.getExtendedMode(), is(true));
        assertThat(stubClient.logged, hasSize(3));
        assertThat(stubClient.logged.get(0).getType(), equalTo(MessageType.Error));
        assertThat(stubClient.logged.get(1).getMessage(), containsString("Invalid value for 'mode': nawk."));
    }

    @Test
    public void ignoresSettingsThatAreNotObjects() {
        ServerOptions options = ServerOptions.fromSettings(new JsonArray(), client);

        assertThat(options.getMaxNumberOfProblems(), equalTo(100));
        assertThat(ServerOptions.fromInitializeParams(RequestBuilders.initialize().build(), client)
                .getExtendedMode(), is(true));
    }

    @Test
    public void readsInitializationOptions() {
        JsonObject initializationOptions = new JsonObject();
        initializationOptions.addProperty("mode", "awk");

        ServerOptions options = ServerOptions.fromInitializeParams(
                RequestBuilders.initialize().initializationOptions(initializationOptions).build(), client);

        assertThat(options.getExtendedMode(), is(false));
    }

    @Test
    public void includePathDefaultsToAwkPath() {
        assertThat(ServerOptions.defaultIncludePath(Map.of()), contains("."));
        assertThat(ServerOptions.defaultIncludePath(Map.of("AWKPATH", " ")), contains("."));
        assertThat(ServerOptions.defaultIncludePath(Map.of("AWKPATH", "/x" + File.pathSeparator + "/y")),
                contains("/x", "/y"));
    }

    @Test
    public void onlyAnalysisSettingsAffectAnalysis() {
        ServerOptions base = ServerOptions.builder().setIncludePath(List.of()).build();

        assertThat(base.affectsAnalysis(ServerOptions.builder().setIncludePath(List.of()).build()), is(false));
        assertThat(base.affectsAnalysis(ServerOptions.builder()
                .setIncludePath(List.of())
                .setExtendedMode(false)
                .build()), is(true));
        assertThat(base.affectsAnalysis(ServerOptions.builder().setIncludePath(List.of("/lib")).build()), is(true));
    }
}
