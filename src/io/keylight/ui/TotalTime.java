package io.keylight.ui;

public record TotalTime(double seconds) {
    public int asSeconds() {
        return (int) Math.round(seconds);
    }

    @Override
    public String toString() {
        int total = (int) Math.max(0, seconds);
        int hr = total / 3600;
        int min = total % 3600 / 60;
        int sec = total % 60;
        return String.format("%02d:%02d:%02d", hr, min, sec);
    }
}
