package de.codesourcery.fftfilter;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.ThreadPoolExecutor.DiscardOldestPolicy;
import java.util.concurrent.TimeUnit;

import de.codesourcery.fftfilter.filter.FilterConfiguration;

/**
 * Holds the currently loaded raster and filter configuration and 
 * runs the filter pipeline on demand.
 * 
 * <p>{@link #applyFilter()} computes on the calling thread. {@link #refresh(IFilterCallback)} hands
 * the computation to a single background thread; when requests overlap only the most recent
 * one is reported, results of superseded requests are dropped.</p>
 * 
 * <p>The raster is never modified, a new one replaces it wholesale.</p>
 */
public final class FilterSession
{
    private final Object LOCK = new Object();

    // @GuardedBy( LOCK )
    private Raster raster;

    // @GuardedBy( LOCK )
    private FilterConfiguration configuration;

    // @GuardedBy( LOCK )
    private long latestRequest;

    private final FrequencyFilter filter;

    private final ThreadPoolExecutor threadPool;

    public FilterSession(FilterConfiguration configuration) 
    {
        this( new FrequencyFilter() , configuration );
    }

    public FilterSession(FrequencyFilter filter,FilterConfiguration configuration)
    {
        if ( filter == null ) {
            throw new IllegalArgumentException("filter must not be NULL");
        }
        if ( configuration == null ) {
            throw new IllegalArgumentException("configuration must not be NULL");
        }
        this.filter = filter;
        this.configuration = configuration;

        final BlockingQueue<Runnable> workQueue = new ArrayBlockingQueue<>(10);

        final ThreadFactory threadFactory = new ThreadFactory() {

            @Override
            public Thread newThread(final Runnable r)
            {
                final Thread t = new Thread( r , "filter-worker" );
                t.setDaemon( true );
                return t;
            }};

        // exactly one worker so requests complete in submission order,
        // when the queue is full the oldest (superseded anyway) request is dropped
        threadPool = new ThreadPoolExecutor(1, 1, 60, TimeUnit.SECONDS, workQueue, threadFactory, new DiscardOldestPolicy() );
    }

    public void setRaster(Raster raster) 
    {
        if ( raster == null ) {
            throw new IllegalArgumentException("raster must not be NULL");
        }
        synchronized(LOCK) {
            this.raster = raster;
        }
    }

    public Raster getRaster() 
    {
        synchronized(LOCK) {
            return raster;
        }
    }

    public void setConfiguration(FilterConfiguration configuration) 
    {
        if ( configuration == null ) {
            throw new IllegalArgumentException("configuration must not be NULL");
        }
        synchronized(LOCK) {
            this.configuration = configuration;
        }
    }

    public FilterConfiguration getConfiguration() 
    {
        synchronized(LOCK) {
            return configuration;
        }
    }

    /**
     * Filters the current raster on the calling thread.
     * 
     * @throws IllegalStateException if no raster has been loaded yet
     */
    public FilterResult applyFilter() 
    {
        final Raster currentRaster;
        final FilterConfiguration currentConfig;
        synchronized(LOCK) 
        {
            currentRaster = raster;
            currentConfig = configuration;
        }
        if ( currentRaster == null ) {
            throw new IllegalStateException("No raster loaded");
        }
        return filter.filter( currentRaster , currentConfig );
    }

    /**
     * Filters the current raster in the background.
     * 
     * @return <code>false</code> if there is no raster to filter yet
     * @throws IllegalStateException if the session has been closed
     */
    public boolean refresh(final IFilterCallback callback) 
    {
        final long request;
        final Raster currentRaster;
        final FilterConfiguration currentConfig;
        synchronized(LOCK) 
        {
            if ( raster == null ) {
                return false;
            }
            request = ++latestRequest;
            currentRaster = raster;
            currentConfig = configuration;
        }

        final Runnable runnable = new Runnable() {

            @Override
            public void run()
            {
                if ( ! isLatestRequest( request ) ) {
                    return;
                }

                FilterResult result = null;
                Exception failure = null;
                try {
                    result = filter.filter( currentRaster , currentConfig );
                } 
                catch(RuntimeException e) {
                    failure = e;
                }

                if ( ! isLatestRequest( request ) ) {
                    return;
                }

                if ( result != null ) {
                    callback.filteringFinished( FilterSession.this , result );
                } else {
                    callback.filteringFailed( FilterSession.this , failure );
                }
            }
        };

        // DiscardOldestPolicy silently drops tasks once the pool is shut down
        if ( threadPool.isShutdown() ) {
            throw new IllegalStateException("Filter session has been closed");
        }
        threadPool.execute( runnable );
        return true;
    }

    private boolean isLatestRequest(long request) 
    {
        synchronized(LOCK) {
            return request == latestRequest;
        }
    }

    public void close() 
    {
        threadPool.shutdownNow();
    }

    public boolean isClosed() 
    {
        return threadPool.isShutdown();
    }
}
