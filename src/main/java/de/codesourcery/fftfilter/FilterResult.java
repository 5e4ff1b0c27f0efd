package de.codesourcery.fftfilter;

import de.codesourcery.fftfilter.filter.FilterConfiguration;

public final class FilterResult
{
    private final FilterConfiguration configuration;
    private final Raster reconstructed;
    private final DisplayBuffer output;
    private final DisplayBuffer spectrum;

    public FilterResult(FilterConfiguration configuration, Raster reconstructed, DisplayBuffer output, DisplayBuffer spectrum)
    {
        this.configuration = configuration;
        this.reconstructed = reconstructed;
        this.output = output;
        this.spectrum = spectrum;
    }

    public FilterConfiguration getConfiguration()
    {
        return configuration;
    }

    /**
     * Magnitude of the back-transformed raster, before normalization.
     */
    public Raster getReconstructed()
    {
        return reconstructed;
    }

    public DisplayBuffer getOutput()
    {
        return output;
    }

    /**
     * Log-magnitude of the masked, centered spectrum.
     */
    public DisplayBuffer getSpectrum()
    {
        return spectrum;
    }

    @Override
    public String toString()
    {
        return "FilterResult [configuration=" + configuration + ", output=" + output + "]";
    }
}
