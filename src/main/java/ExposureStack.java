/**
** -----------------------------------------------------------------------------**
** ExposureStack.java
**
** Set of differently exposed images of a static scene
**
**
** Copyright (C) 2014 Elphel, Inc.
**
** -----------------------------------------------------------------------------**
**
**  ExposureStack.java is free software: you can redistribute it and/or modify
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

import ij.ImagePlus;
import ij.ImageStack;
import ij.process.ColorProcessor;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;

/**
 * Exposures of the same scene. Every exposure is kept as an ImageStack with one
 * float slice per color channel, pixel values nominally in [0,1], and the exposure
 * time in seconds. All exposures share width, height and number of channels.
 */
public class ExposureStack {
	public static final String EXPOSURE_PROPERTY="EXPOSURE";
	public static final int    MAX_CODE=255;

	private final ImageStack [] exposureStacks;
	private final double []     exposures;
	private final int width;
	private final int height;
	private final int numChannels;

	/**
	 * Build stack from images with "EXPOSURE" property set (seconds)
	 * @param images differently exposed images of the same scene
	 * @throws CRFException when there are no images, exposure is missing/invalid or
	 * images do not match
	 */
	public ExposureStack(ImagePlus [] images) throws CRFException {
		this(images, exposuresFromProperties(images));
	}

	public ExposureStack(ImagePlus [] images, double [] exposures) throws CRFException {
		if ((images==null) || (images.length==0)){
			throw new CRFException(CRFException.Kind.INSUFFICIENT_DATA, "Exposure stack is empty");
		}
		if ((exposures==null) || (exposures.length!=images.length)){
			throw new CRFException(CRFException.Kind.INVALID_PARAMETER,
					"Number of exposure times ("+((exposures==null)?"null":exposures.length)+
					") does not match number of images ("+images.length+")");
		}
		ImageStack [] stacks=new ImageStack[images.length];
		for (int n=0;n<images.length;n++){
			if (images[n]==null) throw new CRFException(CRFException.Kind.INSUFFICIENT_DATA, "Exposure "+n+" is missing");
			stacks[n]=getFloatChannels(images[n]);
		}
		this.exposureStacks=stacks;
		this.exposures=exposures.clone();
		this.width=      stacks[0].getWidth();
		this.height=     stacks[0].getHeight();
		this.numChannels=stacks[0].getSize();
		validate();
	}

	/**
	 * Build stack from float channel stacks (one slice per color channel)
	 * @param channelStacks one ImageStack per exposure
	 * @param exposures exposure times, seconds
	 * @throws CRFException when the stacks do not make a valid exposure stack
	 */
	public ExposureStack(ImageStack [] channelStacks, double [] exposures) throws CRFException {
		if ((channelStacks==null) || (channelStacks.length==0)){
			throw new CRFException(CRFException.Kind.INSUFFICIENT_DATA, "Exposure stack is empty");
		}
		if ((exposures==null) || (exposures.length!=channelStacks.length)){
			throw new CRFException(CRFException.Kind.INVALID_PARAMETER,
					"Number of exposure times does not match number of images ("+channelStacks.length+")");
		}
		for (int n=0;n<channelStacks.length;n++){
			if (channelStacks[n]==null) throw new CRFException(CRFException.Kind.INSUFFICIENT_DATA, "Exposure "+n+" is missing");
		}
		this.exposureStacks=channelStacks.clone();
		this.exposures=exposures.clone();
		this.width=      channelStacks[0].getWidth();
		this.height=     channelStacks[0].getHeight();
		this.numChannels=channelStacks[0].getSize();
		validate();
	}

	private void validate() throws CRFException{
		for (int n=0;n<this.exposureStacks.length;n++){
			ImageStack stack=this.exposureStacks[n];
			if ((stack.getWidth()!=this.width) || (stack.getHeight()!=this.height) || (stack.getSize()!=this.numChannels)){
				throw new CRFException(CRFException.Kind.DIMENSION_MISMATCH,
						"Exposure "+n+" is "+stack.getWidth()+"x"+stack.getHeight()+"x"+stack.getSize()+
						", expected "+this.width+"x"+this.height+"x"+this.numChannels);
			}
			for (int chn=0;chn<this.numChannels;chn++){
				if (!(stack.getPixels(chn+1) instanceof float[])){
					throw new CRFException(CRFException.Kind.INVALID_PARAMETER,
							"Exposure "+n+", channel "+chn+" is not a float image");
				}
			}
			if (!(this.exposures[n]>0.0)){ // catches NaN too
				throw new CRFException(CRFException.Kind.INVALID_PARAMETER,
						"Exposure time of image "+n+" should be positive, got "+this.exposures[n]);
			}
		}
	}

	public int getNumExposures() {return this.exposureStacks.length;}
	public int getNumChannels()  {return this.numChannels;}
	public int getWidth()        {return this.width;}
	public int getHeight()       {return this.height;}
	public double getExposure(int nExp) {return this.exposures[nExp];}

	/**
	 * Natural logarithms of the exposure times
	 * @return ln(t) per exposure
	 */
	public double [] getLogExposures(){
		double [] logExposures=new double[this.exposures.length];
		for (int i=0;i<logExposures.length;i++) logExposures[i]=Math.log(this.exposures[i]);
		return logExposures;
	}

	public float [] getPixels(int chn, int nExp){
		return (float []) this.exposureStacks[nExp].getPixels(chn+1);
	}

	public ImageStack getChannels(int nExp){
		return this.exposureStacks[nExp];
	}

	/**
	 * Device code of a pixel
	 * @param chn color channel
	 * @param nExp exposure index
	 * @param x pixel column
	 * @param y pixel row
	 * @return code 0..255
	 */
	public int getCode(int chn, int nExp, int x, int y){
		return toCode(getPixels(chn,nExp)[y*this.width+x]);
	}

	/**
	 * Quantize normalized pixel value to 8-bit device code
	 * @param v pixel value, nominally in [0,1]
	 * @return round(v*255) clamped to [0,255]
	 */
	public static int toCode(double v){
		if (Double.isNaN(v)) return 0;
		long code=Math.round(v*MAX_CODE);
		if (code<0) return 0;
		if (code>MAX_CODE) return MAX_CODE;
		return (int) code;
	}

	public static double [] exposuresFromProperties(ImagePlus [] images) throws CRFException {
		if ((images==null) || (images.length==0)){
			throw new CRFException(CRFException.Kind.INSUFFICIENT_DATA, "Exposure stack is empty");
		}
		double [] exposures=new double[images.length];
		for (int n=0;n<images.length;n++){
			if (images[n]==null) throw new CRFException(CRFException.Kind.INSUFFICIENT_DATA, "Exposure "+n+" is missing");
			Object exposure=images[n].getProperty(EXPOSURE_PROPERTY);
			if (exposure==null){
				throw new CRFException(CRFException.Kind.INVALID_PARAMETER,
						"Image "+images[n].getTitle()+" does not have "+EXPOSURE_PROPERTY+" property");
			}
			try {
				exposures[n]=Double.parseDouble(exposure.toString());
			} catch (NumberFormatException e){
				throw new CRFException(CRFException.Kind.INVALID_PARAMETER,
						"Image "+images[n].getTitle()+" has invalid "+EXPOSURE_PROPERTY+" property: "+exposure, e);
			}
		}
		return exposures;
	}

	/**
	 * Represent image as a stack of float channels in [0,1]. 32-bit images are used as is
	 * (pixel arrays are shared), 8-bit and 16-bit are scaled, RGB is split into 3 channels.
	 * Every slice of a stack is a separate channel.
	 * @param imp source image
	 * @return stack with a float slice per channel
	 */
	public static ImageStack getFloatChannels(ImagePlus imp){
		ImageStack stack=imp.getStack();
		int width= stack.getWidth();
		int height=stack.getHeight();
		if (imp.getType()==ImagePlus.COLOR_RGB){
			ImageStack rgbStack=new ImageStack(width,height);
			String [] names={"red","green","blue"};
			for (int slice=1;slice<=stack.getSize();slice++){
				ColorProcessor cp=(ColorProcessor) stack.getProcessor(slice);
				byte [][] rgb=new byte[3][width*height];
				cp.getRGB(rgb[0],rgb[1],rgb[2]);
				for (int c=0;c<3;c++){
					float [] fpixels=new float[width*height];
					for (int i=0;i<fpixels.length;i++) fpixels[i]=(rgb[c][i] & 0xff)/255.0f;
					rgbStack.addSlice(names[c]+((stack.getSize()>1)?("-"+slice):""), fpixels);
				}
			}
			return rgbStack;
		}
		if (imp.getType()==ImagePlus.GRAY32) return stack;
		double scale=(imp.getType()==ImagePlus.GRAY16)?(1.0/65535.0):(1.0/255.0);
		ImageStack floatStack=new ImageStack(width,height);
		for (int slice=1;slice<=stack.getSize();slice++){
			ImageProcessor ip=stack.getProcessor(slice);
			FloatProcessor fp=ip.convertToFloatProcessor();
			float [] fpixels=(float[]) fp.getPixels();
			for (int i=0;i<fpixels.length;i++) fpixels[i]*=scale;
			floatStack.addSlice(stack.getSliceLabel(slice), fpixels);
		}
		return floatStack;
	}
}
