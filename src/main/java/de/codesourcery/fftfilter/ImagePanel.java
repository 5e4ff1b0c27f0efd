package de.codesourcery.fftfilter;

import java.awt.Color;
import java.awt.Dimension;
import java.awt.Graphics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.geom.Rectangle2D;
import java.awt.image.BufferedImage;

import javax.swing.BorderFactory;
import javax.swing.JPanel;

/**
 * Paints a {@link DisplayBuffer} scaled to the panel size, keeping the aspect ratio.
 */
public final class ImagePanel extends JPanel 
{
    private final String title;

    private volatile BufferedImage image;

    public ImagePanel(String title,int width,int height) 
    {
        this.title = title;
        setPreferredSize( new Dimension( width , height ) );
        setMinimumSize( new Dimension( width / 4 , height / 4 ) );
        setBorder( BorderFactory.createLineBorder( Color.GRAY ) );
    }

    public void setImage(DisplayBuffer buffer) 
    {
        this.image = buffer != null ? buffer.toImage() : null;
        repaint();
    }

    @Override
    protected void paintComponent(Graphics g)
    {
        super.paintComponent(g);

        final BufferedImage current = image;
        if ( current == null ) 
        {
            // nothing loaded yet, render title centered
            final Rectangle2D bounds = g.getFontMetrics().getStringBounds( title , g );
            g.setColor( Color.BLACK );
            g.drawString( title , 
                    (int) Math.round( ( getWidth() - bounds.getWidth() ) / 2 ) , 
                    (int) Math.round( ( getHeight() + bounds.getHeight() ) / 2 ) );
            return;
        }

        final double scale = Math.min( getWidth() / (double) current.getWidth() , getHeight() / (double) current.getHeight() );
        final int w = (int) Math.round( current.getWidth() * scale );
        final int h = (int) Math.round( current.getHeight() * scale );
        final int x = ( getWidth() - w ) / 2;
        final int y = ( getHeight() - h ) / 2;

        final Graphics2D g2 = (Graphics2D) g;
        g2.setRenderingHint( RenderingHints.KEY_INTERPOLATION , RenderingHints.VALUE_INTERPOLATION_BILINEAR );
        g2.drawImage( current , x , y , w , h , null );
    }
}
