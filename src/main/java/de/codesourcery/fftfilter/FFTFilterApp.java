package de.codesourcery.fftfilter;

import java.awt.Font;
import java.awt.GridBagConstraints;
import java.awt.GridBagLayout;
import java.awt.event.ActionEvent;
import java.awt.event.ActionListener;
import java.awt.event.WindowAdapter;
import java.awt.event.WindowEvent;
import java.io.File;
import java.io.IOException;

import javax.swing.BorderFactory;
import javax.swing.BoxLayout;
import javax.swing.ButtonGroup;
import javax.swing.JButton;
import javax.swing.JCheckBox;
import javax.swing.JFileChooser;
import javax.swing.JFrame;
import javax.swing.JLabel;
import javax.swing.JPanel;
import javax.swing.JRadioButton;
import javax.swing.JSlider;
import javax.swing.SwingConstants;
import javax.swing.SwingUtilities;
import javax.swing.event.ChangeEvent;
import javax.swing.event.ChangeListener;
import javax.swing.filechooser.FileNameExtensionFilter;

import org.apache.commons.lang.StringUtils;

import de.codesourcery.fftfilter.filter.FilterConfiguration;
import de.codesourcery.fftfilter.filter.FilterMode;

/**
 * Desktop front end: loads an image or GeoTIFF, lets the user pick a filter
 * and shows input and filtered output side by side.
 */
public class FFTFilterApp
{
    public static final int MIN_RADIUS = 1;
    public static final int MAX_RADIUS = 200;

    public static final int DEFAULT_CUTOFF = 40;
    public static final int DEFAULT_BANDPASS_LOW = 20;
    public static final int DEFAULT_BANDPASS_HIGH = 60;

    private static final int IMAGE_WIDTH = 500;
    private static final int IMAGE_HEIGHT = 400;

    private final JFrame frame = new JFrame("2D FFT Filters (LPF / HPF / BPF)");

    private final ImagePanel inputPanel = new ImagePanel("Input Image" , IMAGE_WIDTH , IMAGE_HEIGHT );
    private final ImagePanel outputPanel = new ImagePanel("Output Image" , IMAGE_WIDTH , IMAGE_HEIGHT );

    private final JRadioButton lowPassButton = new JRadioButton( FilterMode.LOWPASS.getLabel() , true );
    private final JRadioButton highPassButton = new JRadioButton( FilterMode.HIGHPASS.getLabel() );
    private final JRadioButton bandPassButton = new JRadioButton( FilterMode.BANDPASS.getLabel() );

    private final JSlider cutoffSlider = new JSlider( MIN_RADIUS , MAX_RADIUS , DEFAULT_CUTOFF );
    private final JSlider lowSlider = new JSlider( MIN_RADIUS , MAX_RADIUS , DEFAULT_BANDPASS_LOW );
    private final JSlider highSlider = new JSlider( MIN_RADIUS , MAX_RADIUS , DEFAULT_BANDPASS_HIGH );

    private final JCheckBox showSpectrum = new JCheckBox("Show filtered spectrum");

    private final RasterLoader loader = new RasterLoader();
    private final FilterSession session = new FilterSession( FilterConfiguration.lowPass( DEFAULT_CUTOFF ) );

    private volatile File currentFile;

    private final IFilterCallback callback = new IFilterCallback() {

        @Override
        public void filteringFinished(FilterSession session, final FilterResult result)
        {
            SwingUtilities.invokeLater( new Runnable() {

                @Override
                public void run()
                {
                    outputPanel.setImage( showSpectrum.isSelected() ? result.getSpectrum() : result.getOutput() );
                }
            });
        }

        @Override
        public void filteringFailed(FilterSession session, Exception e)
        {
            System.err.println("Filtering failed: "+e.getMessage());
            e.printStackTrace();
        }
    };

    public static void main(final String[] args) throws Exception
    {
        SwingUtilities.invokeLater( new Runnable() {

            @Override
            public void run()
            {
                final FFTFilterApp app = new FFTFilterApp();
                app.show();
                if ( args.length > 0 && StringUtils.isNotBlank( args[0] ) ) {
                    app.loadImage( new File( args[0] ) );
                }
            }
        });
    }

    public void show() 
    {
        final JLabel title = new JLabel("2D FFT Image Filtering (GeoTIFF Supported)" , SwingConstants.CENTER );
        title.setFont( title.getFont().deriveFont( Font.BOLD , 18f ) );

        final JPanel content = new JPanel();
        content.setLayout( new GridBagLayout() );

        GridBagConstraints cnstrs = new GridBagConstraints();
        cnstrs.fill = GridBagConstraints.HORIZONTAL;
        cnstrs.gridx=0;
        cnstrs.gridy=0;
        cnstrs.gridwidth=3;
        cnstrs.weightx=1.0;
        cnstrs.weighty=0;
        content.add( title , cnstrs );

        cnstrs = new GridBagConstraints();
        cnstrs.fill = GridBagConstraints.BOTH;
        cnstrs.gridx=0;
        cnstrs.gridy=1;
        cnstrs.weightx=1.0;
        cnstrs.weighty=1.0;
        content.add( inputPanel , cnstrs );

        cnstrs = new GridBagConstraints();
        cnstrs.fill = GridBagConstraints.VERTICAL;
        cnstrs.gridx=1;
        cnstrs.gridy=1;
        cnstrs.weightx=0;
        cnstrs.weighty=1.0;
        content.add( createControls() , cnstrs );

        cnstrs = new GridBagConstraints();
        cnstrs.fill = GridBagConstraints.BOTH;
        cnstrs.gridx=2;
        cnstrs.gridy=1;
        cnstrs.weightx=1.0;
        cnstrs.weighty=1.0;
        content.add( outputPanel , cnstrs );

        frame.getContentPane().add( content );
        frame.addWindowListener( new WindowAdapter() {
            @Override
            public void windowClosing(WindowEvent e) 
            {
                session.close();
                super.windowClosing(e);
            }
        });
        frame.setDefaultCloseOperation( JFrame.DISPOSE_ON_CLOSE );
        frame.pack();
        frame.setLocation( 100 , 100 );
        frame.setVisible( true );
    }

    private JPanel createControls() 
    {
        final JPanel controls = new JPanel();
        controls.setBorder( BorderFactory.createTitledBorder("Controls") );
        controls.setLayout( new BoxLayout( controls , BoxLayout.Y_AXIS ) );

        final JButton uploadButton = new JButton("Upload Image / GeoTIFF");
        uploadButton.setFocusable( false );
        uploadButton.addActionListener( new ActionListener() {

            @Override
            public void actionPerformed(ActionEvent e)
            {
                chooseImage();
            }
        });

        final ButtonGroup group = new ButtonGroup();
        final ActionListener modeListener = new ActionListener() {

            @Override
            public void actionPerformed(ActionEvent e)
            {
                updateSliderState();
                applyFilter();
            }
        };
        for ( JRadioButton button : new JRadioButton[] { lowPassButton , highPassButton , bandPassButton } ) 
        {
            group.add( button );
            button.addActionListener( modeListener );
        }

        final ChangeListener sliderListener = new ChangeListener() {

            @Override
            public void stateChanged(ChangeEvent e)
            {
                applyFilter();
            }
        };
        cutoffSlider.addChangeListener( sliderListener );
        lowSlider.addChangeListener( sliderListener );
        highSlider.addChangeListener( sliderListener );
        showSpectrum.addActionListener( modeListener );

        controls.add( uploadButton );
        controls.add( lowPassButton );
        controls.add( highPassButton );
        controls.add( bandPassButton );
        controls.add( new JLabel("Cutoff Frequency") );
        controls.add( cutoffSlider );
        controls.add( new JLabel("Band-Pass Lower Cutoff") );
        controls.add( lowSlider );
        controls.add( new JLabel("Band-Pass Upper Cutoff") );
        controls.add( highSlider );
        controls.add( showSpectrum );

        updateSliderState();
        return controls;
    }

    private void updateSliderState() 
    {
        final boolean bandPass = bandPassButton.isSelected();
        cutoffSlider.setEnabled( ! bandPass );
        lowSlider.setEnabled( bandPass );
        highSlider.setEnabled( bandPass );
    }

    protected FilterConfiguration getConfiguration() 
    {
        if ( bandPassButton.isSelected() ) {
            return FilterConfiguration.bandPass( lowSlider.getValue() , highSlider.getValue() );
        }
        if ( highPassButton.isSelected() ) {
            return FilterConfiguration.highPass( cutoffSlider.getValue() );
        }
        return FilterConfiguration.lowPass( cutoffSlider.getValue() );
    }

    private void applyFilter() 
    {
        session.setConfiguration( getConfiguration() );
        session.refresh( callback );
    }

    private void chooseImage() 
    {
        final File previous = currentFile;
        final JFileChooser fc;
        if ( previous != null && previous.getParentFile() != null && previous.getParentFile().isDirectory() ) {
            fc = new JFileChooser( previous.getParentFile() );
        } else {
            fc = new JFileChooser();
        }
        fc.setFileFilter( new FileNameExtensionFilter("Images (*.png *.jpg *.bmp *.tif *.tiff)" , 
                "png" , "jpg" , "jpeg" , "bmp" , "gif" , "tif" , "tiff" ) );

        if ( fc.showDialog( frame , "Open Image / GeoTIFF") == JFileChooser.APPROVE_OPTION ) {
            loadImage( fc.getSelectedFile() );
        }
    }

    public void loadImage(File file) 
    {
        final Raster raster;
        try {
            raster = loader.load( file );
        } 
        catch (IOException e) 
        {
            System.err.println("Failed to read image: "+e.getMessage());
            e.printStackTrace();
            return;
        }

        System.out.println("Loaded "+file.getAbsolutePath()+" : "+raster);
        currentFile = file;
        frame.setTitle( "2D FFT Filters (LPF / HPF / BPF) - "+file.getName() );

        session.setRaster( raster );
        inputPanel.setImage( new DisplayNormalizer().normalize( raster ) );
        applyFilter();
    }
}
