package io.github.hotbrkm.mailgoat.dispatcher.cli;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.github.hotbrkm.mailgoat.dispatcher.profile.MailProfile;
import io.github.hotbrkm.mailgoat.dispatcher.profile.ProfileStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * {@code profile add|list|use}: manages stored sender profiles. API keys are never printed in full.
 */
@Component
@RequiredArgsConstructor
public class ProfileCommand implements MailgoatCommand {

    static final String NAME = "profile";
    private static final Set<String> ADD_OPTIONS = Set.of("server", "api-key", "from-address", "from-name");
    private static final Set<String> FLAGS = Set.of("default");

    private final ProfileStore profileStore;
    private final CliJsonWriter jsonWriter;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String usage() {
        return "profile add <name> --server URL --api-key KEY [--from-address ADDR] [--from-name NAME] [--default]\n"
                + "  profile list\n"
                + "  profile use <name>";
    }

    @Override
    public Set<String> flags() {
        return FLAGS;
    }

    @Override
    public int execute(CommandLineArgs args, CommandIo io) {
        String action = args.positional(0, "profile subcommand (add, list or use)");
        switch (action) {
            case "add" -> add(args, io);
            case "list" -> list(args, io);
            case "use" -> use(args, io);
            default -> throw new CliUsageException("unknown profile subcommand: " + action);
        }
        return ExitCodes.OK;
    }

    private void add(CommandLineArgs args, CommandIo io) {
        args.requireKnown(ADD_OPTIONS, FLAGS);
        String name = args.positional(1, "profile name");
        args.requireMaxPositionals(2);
        MailProfile profile = MailProfile.builder()
                .name(name.trim())
                .server(args.requireOption("server").trim())
                .apiKey(args.requireOption("api-key").trim())
                .fromAddress(blankToNull(args.option("from-address")))
                .fromName(blankToNull(args.option("from-name")))
                .build();
        profileStore.add(profile, args.hasFlag("default"));
        String defaultName = profileStore.defaultProfileName().orElse(null);
        jsonWriter.print(io.out(), ProfileView.of(profile, profile.name().equals(defaultName)));
    }

    private void list(CommandLineArgs args, CommandIo io) {
        args.requireKnown(Set.of(), Set.of());
        args.requireMaxPositionals(1);
        String defaultName = profileStore.defaultProfileName().orElse(null);
        List<ProfileView> views = profileStore.list().stream()
                .map(p -> ProfileView.of(p, p.name().equals(defaultName)))
                .toList();
        jsonWriter.print(io.out(), views);
    }

    private void use(CommandLineArgs args, CommandIo io) {
        args.requireKnown(Set.of(), Set.of());
        String name = args.positional(1, "profile name");
        args.requireMaxPositionals(2);
        profileStore.setDefault(name.trim());
        jsonWriter.print(io.out(), Map.of("default_profile", name.trim()));
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    /**
     * Printable profile with the API key masked.
     */
    record ProfileView(String name, String server, String apiKey, String fromAddress, String fromName,
                       @JsonProperty("default") boolean defaultProfile) {

        static ProfileView of(MailProfile profile, boolean isDefault) {
            return new ProfileView(profile.name(), profile.server(), profile.maskedApiKey(), profile.fromAddress(),
                    profile.fromName(), isDefault);
        }
    }
}
