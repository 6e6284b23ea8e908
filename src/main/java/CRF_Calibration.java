/**
** -----------------------------------------------------------------------------**
** CRF_Calibration.java
**
** ImageJ plugin: estimate camera response function from exposure stacks or
** RAW/JPEG pairs, linearize images with it
**
** Copyright (C) 2014 Elphel, Inc.
**
** -----------------------------------------------------------------------------**
**
**  CRF_Calibration.java is free software: you can redistribute it and/or modify
**  it under the terms of the GNU General Public License as published by
**  the Free Software Foundation, either version 3 of the License, or
**  (at your option) any later version.
**
**  This program is distributed in the hope that it will be useful,
**  but WITHOUT ANY WARRANTY; without even the implied warranty of
**  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
**  GNU General Public License for more details.
**
**  You should have received a copy of the GNU General Public License
**  along with this program.  If not, see <http://www.gnu.org/licenses/>.
** -----------------------------------------------------------------------------**
**
*/

import ij.IJ;
import ij.ImagePlus;
import ij.Macro;
import ij.Prefs;
import ij.WindowManager;
import ij.gui.GenericDialog;
import ij.gui.Plot;
import ij.io.OpenDialog;
import ij.io.SaveDialog;
import ij.plugin.PlugIn;

import java.awt.Color;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Properties;

public class CRF_Calibration implements PlugIn {
	public static final String [] ACTIONS={
		"Estimate from open exposures",
		"Estimate from RAW/JPEG pair",
		"Linearize current image",
		"Apply response to current image",
		"Load response",
		"Save response",
		"Plot response",
		"Configure"};
	public static final String PREFIX="CRF_CALIBRATION.";
	public static final Color [] CHANNEL_COLORS={Color.red, Color.green, Color.blue, Color.black};

	public static CRFParameters PARAMETERS=new CRFParameters();
	public static CameraResponseFunction CRF=null;
	public static CRFApplicator.LinearizationMode MODE=CRFApplicator.LinearizationMode.LUT_8_BIT;
	public static String RESPONSE_PATH="";
	private String prefsPath;
	private static int lastAction=0;

	public void run(String arg) {
		String options=Macro.getOptions();
		try {
			this.prefsPath=Macro.getValue(options, "prefs", Prefs.getPrefsDir()+Prefs.getFileSeparator()+"CRF_Calibration.xml");
		} catch(Exception e) {
			this.prefsPath=Prefs.getPrefsDir()+Prefs.getFileSeparator()+"CRF_Calibration.xml";
		}
		if (IJ.versionLessThan("1.43q")) return;
		try {
			loadPrefs();
		} catch (IOException e) {
			IJ.log("Failed to load preferences: "+e.getMessage());
		}
		GenericDialog gd = new GenericDialog("Camera response function");
		gd.addChoice("Action", ACTIONS, ACTIONS[lastAction]);
		gd.showDialog();
		if (gd.wasCanceled()) return;
		lastAction=gd.getNextChoiceIndex();
		try {
			switch (lastAction){
			case 0: estimateFromExposures(); break;
			case 1: estimateFromRawJpeg();   break;
			case 2: convertCurrentImage(true);  break;
			case 3: convertCurrentImage(false); break;
			case 4: loadResponse(); break;
			case 5: saveResponse(); break;
			case 6: plotResponse(CRF, "Camera response"); break;
			case 7: if (PARAMETERS.showDialog("Camera response parameters")) savePrefs(); break;
			default: break;
			}
		} catch (CRFException e){
			IJ.showMessage("Error", e.getMessage());
		} catch (IOException e){
			IJ.showMessage("Error", e.getMessage());
		}
	}

	public void estimateFromExposures() throws CRFException {
		int [] ids=WindowManager.getIDList();
		if ((ids==null) || (ids.length<2)){
			throw new CRFException(CRFException.Kind.INSUFFICIENT_DATA, "Open at least 2 exposures of the same scene");
		}
		ImagePlus [] images=new ImagePlus[ids.length];
		double [] exposures=new double[ids.length];
		GenericDialog gd = new GenericDialog("Exposure times");
		for (int i=0;i<ids.length;i++){
			images[i]=WindowManager.getImage(ids[i]);
			gd.addNumericField(images[i].getTitle()+" exposure (s)", suggestedExposure(images[i],i), 6);
		}
		gd.showDialog();
		if (gd.wasCanceled()) return;
		for (int i=0;i<ids.length;i++) exposures[i]=gd.getNextNumber();
		ExposureStack exposureStack=new ExposureStack(images, exposures);
		CRF=new CRFEstimator(PARAMETERS).estimate(exposureStack);
		plotResponse(CRF, "Camera response ("+PARAMETERS.weightFunction.getDescription()+", lambda="+PARAMETERS.lambda+")");
	}

	/**
	 * Exposure time offered in the dialog: the image EXPOSURE property, or 2^index when it is missing or not a number
	 */
	public static double suggestedExposure(ImagePlus imp, int index){
		Object exposure=imp.getProperty(ExposureStack.EXPOSURE_PROPERTY);
		if (exposure!=null){
			try {
				return Double.parseDouble(exposure.toString());
			} catch (NumberFormatException e){
				IJ.log("Warning: "+imp.getTitle()+" has invalid "+ExposureStack.EXPOSURE_PROPERTY+" property: "+exposure);
			}
		}
		return Math.pow(2.0,index);
	}

	public void estimateFromRawJpeg() throws CRFException {
		int [] ids=WindowManager.getIDList();
		if ((ids==null) || (ids.length<2)){
			throw new CRFException(CRFException.Kind.INSUFFICIENT_DATA, "Open RAW and JPEG images of the same scene");
		}
		String [] titles=new String[ids.length];
		for (int i=0;i<ids.length;i++) titles[i]=WindowManager.getImage(ids[i]).getTitle();
		GenericDialog gd = new GenericDialog("RAW/JPEG pair");
		gd.addChoice("RAW image",  titles, titles[0]);
		gd.addChoice("JPEG image", titles, titles[1]);
		gd.addNumericField("Smoothing window (0 - none)", PARAMETERS.filterSize, 0);
		gd.showDialog();
		if (gd.wasCanceled()) return;
		ImagePlus raw= WindowManager.getImage(ids[gd.getNextChoiceIndex()]);
		ImagePlus jpeg=WindowManager.getImage(ids[gd.getNextChoiceIndex()]);
		PARAMETERS.filterSize=(int) gd.getNextNumber();
		CRF=new CRFEstimator(PARAMETERS).estimateFromRawJpeg(raw, jpeg);
		if (!CRF.isMonotonic()) IJ.log("Warning: camera response from "+raw.getTitle()+"/"+jpeg.getTitle()+" is not monotonic");
		plotResponse(CRF, "Camera response from "+raw.getTitle()+"/"+jpeg.getTitle());
	}

	public void convertCurrentImage(boolean linearize){
		ImagePlus imp=WindowManager.getCurrentImage();
		if (imp==null){
			IJ.showMessage("Error","No image selected");
			return;
		}
		String [] modes=new String[CRFApplicator.LinearizationMode.values().length];
		for (int i=0;i<modes.length;i++) modes[i]=CRFApplicator.LinearizationMode.values()[i].getDescription();
		GenericDialog gd = new GenericDialog(linearize?"Linearize":"Apply response");
		gd.addChoice("Conversion", modes, MODE.getDescription());
		gd.showDialog();
		if (gd.wasCanceled()) return;
		MODE=CRFApplicator.LinearizationMode.values()[gd.getNextChoiceIndex()];
		ImagePlus impFloat=new ImagePlus(imp.getTitle()+(linearize?"-linear":"-response"),
				ExposureStack.getFloatChannels((imp.getType()==ImagePlus.GRAY32)?imp.duplicate():imp));
		CRFApplicator applicator=new CRFApplicator(CRF, PARAMETERS.debugLevel);
		boolean done=linearize?applicator.linearize(impFloat, MODE):applicator.applyResponse(impFloat, MODE);
		if (done) impFloat.show();
	}

	public void loadResponse() throws IOException, CRFException {
		String path=(new OpenDialog("Camera response file", RESPONSE_PATH)).getPath();
		if (path==null) return;
		CRF=CameraResponseFunction.loadFromXML(path);
		RESPONSE_PATH=path;
		savePrefs();
	}

	public void saveResponse() throws IOException {
		if (CRF==null){
			IJ.showMessage("Error","No camera response to save");
			return;
		}
		SaveDialog sd=new SaveDialog("Save camera response", "camera-response", ".crf-xml");
		if (sd.getFileName()==null) return;
		String path=sd.getDirectory()+sd.getFileName();
		CRF.saveToXML(path, "weights: "+CRF.getWeightFunction()+", source: "+CRF.getSource());
		RESPONSE_PATH=path;
		savePrefs();
	}

	public static Plot plotResponse(CameraResponseFunction crf, String title){
		if (crf==null){
			IJ.showMessage("Error","No camera response estimated or loaded");
			return null;
		}
		double [] codes=new double[CameraResponseFunction.CODES];
		for (int i=0;i<codes.length;i++) codes[i]=i;
		double yMax=0.0;
		for (int chn=0;chn<crf.getNumChannels();chn++) yMax=Math.max(yMax, crf.getMax(chn));
		Plot plot=new Plot(title, "device code", "relative irradiance");
		plot.setLimits(0, CameraResponseFunction.CODES-1, 0, (yMax>0.0)?yMax:1.0);
		for (int chn=0;chn<crf.getNumChannels();chn++){
			float [] curve=crf.getCurve(chn);
			double [] values=new double[curve.length];
			for (int i=0;i<curve.length;i++) values[i]=curve[i];
			plot.setColor(CHANNEL_COLORS[(crf.getNumChannels()==1)?(CHANNEL_COLORS.length-1):(chn%CHANNEL_COLORS.length)]);
			plot.addPoints(codes, values, Plot.LINE);
		}
		plot.show();
		return plot;
	}

	public void loadPrefs() throws IOException{
		InputStream is;
		try {
			is = new FileInputStream(this.prefsPath);
		} catch (FileNotFoundException e) {
			if (PARAMETERS.debugLevel>0) System.out.println("Warning: Failed to open configuration file: "+this.prefsPath);
			return;
		}
		try {
			Properties properties=new Properties();
			properties.loadFromXML(is);
			PARAMETERS.getProperties(PREFIX, properties);
			if (properties.getProperty(PREFIX+"responsePath")!=null) RESPONSE_PATH=properties.getProperty(PREFIX+"responsePath");
			if (properties.getProperty(PREFIX+"linearizationMode")!=null)
				MODE=CRFApplicator.LinearizationMode.valueOf(properties.getProperty(PREFIX+"linearizationMode"));
			if (PARAMETERS.debugLevel>0) System.out.println("Configuration parameters are restored from "+this.prefsPath);
		} finally {
			is.close();
		}
	}

	public void savePrefs() throws IOException{
		Properties properties=new Properties();
		PARAMETERS.setProperties(PREFIX, properties);
		properties.setProperty(PREFIX+"responsePath", RESPONSE_PATH);
		properties.setProperty(PREFIX+"linearizationMode", MODE.name());
		OutputStream os=new FileOutputStream(this.prefsPath);
		try {
			properties.storeToXML(os, "last updated " + new java.util.Date(), "UTF8");
		} finally {
			os.close();
		}
		if (PARAMETERS.debugLevel>0) System.out.println("Configuration parameters are saved to "+this.prefsPath);
	}
}
