package io.keylight.playback;

@FunctionalInterface
public interface PlaybackIssueListener {
    void onIssue(PlaybackIssue issue);
}
