package de.codesourcery.fftfilter;

import de.codesourcery.fftfilter.filter.FilterConfiguration;
import de.codesourcery.fftfilter.filter.Mask;
import de.codesourcery.fftfilter.filter.MaskBuilder;

/**
 * Applies a radial frequency-domain filter to a raster.
 * 
 * Stateless, every call runs the whole pipeline: forward transform, mask, 
 * inverse transform, magnitude and (for {@link #apply(Raster, FilterConfiguration)})
 * normalization for display.
 */
public class FrequencyFilter
{
    private final SpectralTransform transform;
    private final MaskBuilder maskBuilder;
    private final DisplayNormalizer normalizer;

    public FrequencyFilter() 
    {
        this( new SpectralTransform() , new MaskBuilder() , new DisplayNormalizer() );
    }

    public FrequencyFilter(SpectralTransform transform, MaskBuilder maskBuilder, DisplayNormalizer normalizer)
    {
        this.transform = transform;
        this.maskBuilder = maskBuilder;
        this.normalizer = normalizer;
    }

    public DisplayBuffer apply(Raster raster,FilterConfiguration config) 
    {
        return normalizer.normalize( reconstruct( raster , config ) );
    }

    /**
     * Returns the magnitude of the filtered, back-transformed raster.
     */
    public Raster reconstruct(Raster raster,FilterConfiguration config) 
    {
        final Spectrum spectrum = transform.forward( raster );
        final Mask mask = maskBuilder.buildMask( raster.getHeight() , raster.getWidth() , config );
        return transform.inverse( spectrum.applyMask( mask ) ).magnitude();
    }

    /**
     * Runs the pipeline and also renders the masked, centered spectrum 
     * (log-magnitude) for display.
     */
    public FilterResult filter(Raster raster,FilterConfiguration config) 
    {
        final Mask mask = maskBuilder.buildMask( raster.getHeight() , raster.getWidth() , config );
        final Spectrum masked = transform.forward( raster ).applyMask( mask );
        final Raster reconstructed = transform.inverse( masked ).magnitude();
        return new FilterResult( config , 
                reconstructed , 
                normalizer.normalize( reconstructed ) , 
                normalizer.normalize( masked.logMagnitude() ) );
    }
}
