package de.codesourcery.fftfilter;

/**
 * Receives the outcome of {@link FilterSession#refresh(IFilterCallback)}.
 * 
 * Methods are invoked on the session's worker thread.
 */
public interface IFilterCallback
{
    public void filteringFinished(FilterSession session,FilterResult result);

    public void filteringFailed(FilterSession session,Exception e);
}
