package de.codesourcery.fftfilter.filter;

/**
 * Active filter mode together with its radius parameter(s).
 * 
 * Low- and high-pass filters use a single cutoff radius, band-pass filters
 * a pair of radii. The band-pass pair is kept as supplied, 
 * {@link #getInnerRadius()} and {@link #getOuterRadius()} always return it in ascending order.
 * Radii are not range-checked.
 */
public final class FilterConfiguration
{
    private final FilterMode mode;
    private final int low;
    private final int high;

    private FilterConfiguration(FilterMode mode, int low, int high)
    {
        if ( mode == null ) {
            throw new IllegalArgumentException("mode must not be NULL");
        }
        this.mode = mode;
        this.low = low;
        this.high = high;
    }

    public static FilterConfiguration lowPass(int cutoff) {
        return new FilterConfiguration( FilterMode.LOWPASS , cutoff , cutoff );
    }

    public static FilterConfiguration highPass(int cutoff) {
        return new FilterConfiguration( FilterMode.HIGHPASS , cutoff , cutoff );
    }

    public static FilterConfiguration bandPass(int low,int high) {
        return new FilterConfiguration( FilterMode.BANDPASS , low , high );
    }

    public FilterMode getMode()
    {
        return mode;
    }

    /**
     * Cutoff radius of a low- or high-pass filter.
     * 
     * @throws IllegalStateException for band-pass configurations
     */
    public int getCutoff() 
    {
        if ( mode == FilterMode.BANDPASS ) {
            throw new IllegalStateException("Band-pass filter has no single cutoff");
        }
        return low;
    }

    public int getInnerRadius() 
    {
        return Math.min( low , high );
    }

    public int getOuterRadius() 
    {
        return Math.max( low , high );
    }

    @Override
    public boolean equals(Object obj)
    {
        if ( this == obj ) {
            return true;
        }
        if ( ! (obj instanceof FilterConfiguration) ) {
            return false;
        }
        final FilterConfiguration other = (FilterConfiguration) obj;
        return mode == other.mode && low == other.low && high == other.high;
    }

    @Override
    public int hashCode()
    {
        return 31*(31*mode.hashCode()+low)+high;
    }

    @Override
    public String toString()
    {
        switch( mode ) 
        {
            case BANDPASS:
                return "FilterConfiguration [mode=" + mode + ", low=" + low + ", high=" + high + "]";
            default:
                return "FilterConfiguration [mode=" + mode + ", cutoff=" + low + "]";
        }
    }
}
