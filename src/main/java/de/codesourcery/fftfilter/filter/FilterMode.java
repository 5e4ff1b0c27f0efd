package de.codesourcery.fftfilter.filter;

public enum FilterMode 
{
    LOWPASS("Low-Pass Filter"),
    HIGHPASS("High-Pass Filter"),
    BANDPASS("Band-Pass Filter");

    private final String label;

    private FilterMode(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
