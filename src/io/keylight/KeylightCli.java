package io.keylight;

import io.keylight.config.LearnSettings;
import io.keylight.config.SettingsLoader;
import io.keylight.device.LiveMidiInput;
import io.keylight.device.MidiDeviceUtils;
import io.keylight.midi.MidiFileLoader;
import io.keylight.midi.exceptions.InvalidConfigurationException;
import io.keylight.midi.exceptions.MalformedTimelineException;
import io.keylight.playback.PlaybackIssue;
import io.keylight.playback.PlaybackState;
import io.keylight.playback.SessionSource;
import io.keylight.playback.SnapshotBroadcaster;
import io.keylight.playback.SyncScheduler;
import io.keylight.ui.StatusLineSink;
import io.keylight.ui.TotalTime;

import javax.sound.midi.MidiUnavailableException;
import java.io.IOException;
import java.nio.file.Path;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Plays a MIDI file in learning mode: the status line shows progress and the next notes to play,
 * and an optional MIDI keyboard is tracked alongside the file.
 *
 * <p>Usage: java KeylightCli [options] file.mid</p>
 */
public final class KeylightCli {
    private static final long POLL_MILLIS = 100;

    public static void main(String[] args) throws Exception {
        if (args.length < 1 || args[0].isBlank()) {
            printOptions();
            System.exit(1);
            return;
        }

        Path file = null, settingsFile = null;
        String device = null;
        String tempo = null;
        boolean verbose = false, loop = false;
        for (int i = 0; i < args.length; ++i) {
            var arg = args[i];
            switch (arg) {
                case "-V", "--version" -> {
                    printVersion();
                    System.exit(1);
                    return;
                }
                case "-H", "--help", "-h" -> {
                    printOptions();
                    System.exit(1);
                    return;
                }
                case "-i", "--input" -> device = requireValue(args, ++i, arg);
                case "-t", "--tempo" -> tempo = requireValue(args, ++i, arg);
                case "-s", "--settings" -> settingsFile = Path.of(requireValue(args, ++i, arg));
                case "-v", "--verbose" -> verbose = true;
                case "-l", "--loop" -> loop = true;
                case "-d", "--devices" -> {
                    MidiDeviceUtils.listInputDevices().forEach(info -> System.out.println(info.getName() + " - " + info.getDescription()));
                    return;
                }
                default -> {
                    if (arg.startsWith("-")) {
                        System.err.println("Unknown option: " + arg);
                        printOptions();
                        System.exit(1);
                        return;
                    }
                    file = Path.of(arg);
                }
            }
        }

        if (verbose)
            setVerbose();
        if (file == null && device == null) {
            System.err.println("Nothing to play: pass a MIDI file, an input device, or both");
            System.exit(1);
            return;
        }

        LearnSettings settings;
        try {
            settings = settingsFile != null ? SettingsLoader.load(settingsFile) : SettingsLoader.defaults();
            if (tempo != null)
                settings = settings.withTempoScale(parseTempo(tempo));
            if (loop)
                settings = settings.withLoop(true);
        } catch (InvalidConfigurationException e) {
            System.err.println("Invalid settings: " + e.getMessage());
            System.exit(1);
            return;
        }

        int status = run(settings, file, device);
        System.exit(status);
    }

    static int run(LearnSettings settings, Path file, String device) throws InterruptedException {
        try (var scheduler = new SyncScheduler(settings);
             var broadcaster = new SnapshotBroadcaster(scheduler::latestSnapshot)) {
            scheduler.addIssueListener(KeylightCli::printIssue);

            MidiDeviceUtils.OpenInput input = null;
            if (device != null) {
                var info = MidiDeviceUtils.findInputDevice(device);
                if (info.isEmpty()) {
                    System.err.println("No MIDI input matches: " + device);
                    return 1;
                }
                try {
                    input = MidiDeviceUtils.open(info.get(),
                            new LiveMidiInput(info.get().getName(), scheduler.router(), scheduler::onDeviceDisconnected));
                } catch (MidiUnavailableException e) {
                    System.err.printf("The MIDI input is unavailable: %s\n%s\n", info.get().getName(), e.getMessage());
                    return 1;
                }
            }

            try {
                return play(settings, file, scheduler, broadcaster);
            } finally {
                if (input != null)
                    input.close();
            }
        }
    }

    private static int play(LearnSettings settings, Path file, SyncScheduler scheduler, SnapshotBroadcaster broadcaster)
            throws InterruptedException {
        try {
            var source = file != null
                    ? SessionSource.file(file, new MidiFileLoader(settings.assignChannelsByTrack()))
                    : SessionSource.liveOnly();
            var session = scheduler.load(source);
            System.out.printf("Loaded %s: %d events, %s\n", session.name(), session.timeline().size(),
                    new TotalTime(session.timeline().durationSeconds()));
            broadcaster.addSink(new StatusLineSink(new TotalTime(session.timeline().durationSeconds()), System.out));
        } catch (IOException e) {
            System.err.printf("The file failed to load: %s\n%s\n", file, e.getMessage());
            return 1;
        } catch (MalformedTimelineException e) {
            System.err.printf("The MIDI file failed to parse: %s\n%s\n", file, e.getMessage());
            return 1;
        }

        scheduler.startTickLoop();
        broadcaster.start(settings.tickIntervalMillis());
        while (scheduler.state() != PlaybackState.STOPPED) {
            Thread.sleep(POLL_MILLIS);
        }
        broadcaster.broadcastOnce();
        return 0;
    }

    private static void printIssue(PlaybackIssue issue) {
        if (issue instanceof PlaybackIssue.QueueOverflow overflow) {
            System.err.printf("\nDropped %d live events\n", overflow.dropped());
        } else if (issue instanceof PlaybackIssue.DeviceDisconnected disconnected) {
            System.err.printf("\nMIDI input %s disconnected%s\n", disconnected.deviceName(),
                    disconnected.continuing() ? ", continuing with the file" : "");
        } else if (issue instanceof PlaybackIssue.LoadFailed failed) {
            System.err.printf("\nCould not load %s\n", failed.sourceName());
        }
    }

    private static String requireValue(String[] args, int i, String option) {
        if (i >= args.length || args[i].startsWith("-")) {
            System.err.println("Option " + option + " needs a value");
            printOptions();
            System.exit(1);
        }
        return args[i];
    }

    private static double parseTempo(String value) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException("Tempo must be a percentage: " + value);
        }
    }

    private static void setVerbose() {
        Logger root = Logger.getLogger("");
        root.setLevel(Level.FINE);
        for (Handler handler : root.getHandlers()) {
            handler.setLevel(Level.FINE);
        }
    }

    private static void printOptions() {
        String msg = "\nKeylight\n\nUsage: keylight [options] [MIDI File]\n\n";
        msg += "Options:\n";
        msg += "\n  -i,--input <name>      Follow a MIDI keyboard (any input whose name contains <name>)";
        msg += "\n  -d,--devices           List MIDI inputs";
        msg += "\n  -t,--tempo <percent>   Playback speed, 100 is the written tempo";
        msg += "\n  -s,--settings <file>   Read settings from a JSON file";
        msg += "\n  -l,--loop              Loop the practice range";
        msg += "\n  -V,--version           Print version information";
        msg += "\n  -H,--help              Print this message";
        msg += "\n  -v,--verbose           Print extra logs";
        System.out.println(msg);
    }

    private static void printVersion() {
        System.out.println("Keylight 0.1.0\n");
    }
}
