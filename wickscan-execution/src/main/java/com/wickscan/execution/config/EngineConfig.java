package com.wickscan.execution.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.wickscan.engine.ScanConfig;
import com.wickscan.exchange.ExchangeConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Map;

/**
 * Root of engine.yaml. Every section has defaults, so a missing file yields a runnable engine.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class EngineConfig {

    public static final String ENV_TELEGRAM_TOKEN = "WICKSCAN_TELEGRAM_TOKEN";
    public static final String ENV_TELEGRAM_CHATS = "WICKSCAN_TELEGRAM_CHATS";

    private ExchangeConfig exchange = new ExchangeConfig();
    private ScanConfig scan = new ScanConfig();
    private EntrySettings entry = new EntrySettings();
    private TrailSettings trail = new TrailSettings();
    private DcaSettings dca = new DcaSettings();
    private SchedulerSettings scheduler = new SchedulerSettings();
    private NotifierSettings notifier = new NotifierSettings();
    private StorageSettings storage = new StorageSettings();
    private ControlSettings control = new ControlSettings();

    public ExchangeConfig getExchange() { return exchange; }
    public void setExchange(ExchangeConfig exchange) { this.exchange = exchange; }

    public ScanConfig getScan() { return scan; }
    public void setScan(ScanConfig scan) { this.scan = scan; }

    public EntrySettings getEntry() { return entry; }
    public void setEntry(EntrySettings entry) { this.entry = entry; }

    public TrailSettings getTrail() { return trail; }
    public void setTrail(TrailSettings trail) { this.trail = trail; }

    public DcaSettings getDca() { return dca; }
    public void setDca(DcaSettings dca) { this.dca = dca; }

    public SchedulerSettings getScheduler() { return scheduler; }
    public void setScheduler(SchedulerSettings scheduler) { this.scheduler = scheduler; }

    public NotifierSettings getNotifier() { return notifier; }
    public void setNotifier(NotifierSettings notifier) { this.notifier = notifier; }

    public StorageSettings getStorage() { return storage; }
    public void setStorage(StorageSettings storage) { this.storage = storage; }

    public ControlSettings getControl() { return control; }
    public void setControl(ControlSettings control) { this.control = control; }

    public static EngineConfig load(Path path) throws IOException {
        if (!Files.exists(path)) {
            return new EngineConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        return mapper.readValue(path.toFile(), EngineConfig.class);
    }

    public void save(Path path) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        mapper.writeValue(path.toFile(), this);
    }

    public static Path defaultPath() {
        return Path.of(System.getProperty("user.home"), ".wickscan", "engine.yaml");
    }

    /**
     * Let secrets come from the environment instead of the file.
     */
    public EngineConfig applyEnvironment(Map<String, String> env) {
        String token = env.get(ENV_TELEGRAM_TOKEN);
        if (token != null && !token.isBlank()) {
            notifier.setTelegramToken(token.trim());
            notifier.setTelegramEnabled(true);
        }
        String chats = env.get(ENV_TELEGRAM_CHATS);
        if (chats != null && !chats.isBlank()) {
            notifier.setTelegramChatIds(Arrays.stream(chats.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList());
        }
        return this;
    }
}
